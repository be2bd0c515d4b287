package com.questrail.meshgate.directory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Predicate;

/**
 * Resolves a user-supplied node reference to a directory record.
 *
 * <p>Steps are tried in order and the first step with any match wins:</p>
 * <ol>
 *   <li>exact node ID string ({@code !00bc614e}),</li>
 *   <li>short name, case-insensitive,</li>
 *   <li>long name, case-insensitive,</li>
 *   <li>decimal node number.</li>
 * </ol>
 *
 * <p>When several records match within a step the most recently heard one is
 * taken. Records never heard sort oldest; remaining ties go to the lowest node
 * number so the result is deterministic for a given snapshot.</p>
 */
public final class NodeResolver
{
    static final Comparator<MeshNodeRecord> PREFERENCE =
            Comparator.comparing(MeshNodeRecord::lastHeard, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                    .reversed()
                    .thenComparingLong(MeshNodeRecord::nodeNumber);

    private final NodeDirectory directory;

    public NodeResolver(NodeDirectory directory)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Optional<MeshNodeRecord> resolve(String reference)
    {
        Objects.requireNonNull(reference, "reference");
        String token = reference.strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }

        List<MeshNodeRecord> snapshot = directory.all();
        String folded = token.toLowerCase(Locale.ROOT);

        Optional<MeshNodeRecord> match = best(snapshot, r -> r.nodeId().equals(token));
        if (match.isEmpty()) {
            match = best(snapshot, r -> r.shortName() != null && r.shortName().toLowerCase(Locale.ROOT).equals(folded));
        }
        if (match.isEmpty()) {
            match = best(snapshot, r -> r.longName() != null && r.longName().toLowerCase(Locale.ROOT).equals(folded));
        }
        if (match.isEmpty()) {
            OptionalLong number = parseNodeNumber(token);
            if (number.isPresent()) {
                long n = number.getAsLong();
                match = best(snapshot, r -> r.nodeNumber() == n);
            }
        }
        return match;
    }

    private static Optional<MeshNodeRecord> best(List<MeshNodeRecord> snapshot, Predicate<MeshNodeRecord> test)
    {
        return snapshot.stream().filter(test).min(PREFERENCE);
    }

    private static OptionalLong parseNodeNumber(String token)
    {
        if (token.length() > 10) {
            return OptionalLong.empty();
        }
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.of(Long.parseLong(token));
    }
}
