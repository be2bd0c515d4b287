package com.questrail.meshgate.irc;

/**
 * Numeric replies used by the gateway.
 */
final class IrcReplies
{
    static final String RPL_WELCOME = "001";
    static final String RPL_YOURHOST = "002";
    static final String RPL_CREATED = "003";
    static final String RPL_MYINFO = "004";
    static final String RPL_ENDOFWHO = "315";
    static final String RPL_CHANNELMODEIS = "324";
    static final String RPL_TOPIC = "332";
    static final String RPL_WHOREPLY = "352";
    static final String RPL_NAMREPLY = "353";
    static final String RPL_ENDOFNAMES = "366";

    static final String ERR_NOSUCHNICK = "401";
    static final String ERR_NOSUCHCHANNEL = "403";
    static final String ERR_NOORIGIN = "409";
    static final String ERR_NORECIPIENT = "411";
    static final String ERR_NOTEXTTOSEND = "412";
    static final String ERR_UNKNOWNCOMMAND = "421";
    static final String ERR_NONICKNAMEGIVEN = "431";
    static final String ERR_ERRONEUSNICKNAME = "432";
    static final String ERR_NICKNAMEINUSE = "433";
    static final String ERR_NOTONCHANNEL = "442";
    static final String ERR_NOTREGISTERED = "451";
    static final String ERR_NEEDMOREPARAMS = "461";
    static final String ERR_ALREADYREGISTRED = "462";
    static final String ERR_CHANOPRIVSNEEDED = "482";

    private IrcReplies() {}

    /** {@code :<server> <numeric> <target> <rest>} */
    static String numeric(String serverName, String numeric, String target, String rest)
    {
        return ":" + serverName + " " + numeric + " " + target + " " + rest;
    }
}
