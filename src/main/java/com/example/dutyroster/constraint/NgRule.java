package com.example.dutyroster.constraint;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * A date, or inclusive date range, on which a member (or everyone) must not be assigned.
 */
public record NgRule(Kind kind, String memberName, LocalDate start, LocalDate end, String reason) {

    public enum Kind {
        MEMBER_DATE,
        GLOBAL_DATE,
        MEMBER_PERIOD
    }

    public NgRule {
        if (kind == null || start == null) {
            throw new IllegalArgumentException("NG rule requires a kind and a date");
        }
        if (end == null) {
            end = start;
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("NG period ends before it starts: " + start + "~" + end);
        }
        if (kind == Kind.GLOBAL_DATE) {
            memberName = null;
        } else if (memberName == null || memberName.isBlank()) {
            throw new IllegalArgumentException("Member NG rule on " + start + " has no member");
        } else {
            memberName = memberName.strip();
        }
    }

    public static NgRule memberDate(String memberName, LocalDate date) {
        return new NgRule(Kind.MEMBER_DATE, memberName, date, date, null);
    }

    public static NgRule memberPeriod(String memberName, LocalDate start, LocalDate end, String reason) {
        return new NgRule(Kind.MEMBER_PERIOD, memberName, start, end, reason);
    }

    public static NgRule global(LocalDate date) {
        return new NgRule(Kind.GLOBAL_DATE, null, date, date, null);
    }

    /**
     * Parses the per-member entry format {@code yyyy-MM-dd} or {@code yyyy-MM-dd/yyyy-MM-dd}.
     */
    public static NgRule parseMemberEntry(String memberName, String entry) {
        if (entry == null || entry.isBlank()) {
            throw new IllegalArgumentException("Empty NG entry for " + memberName);
        }
        String[] parts = entry.strip().split("/", -1);
        if (parts.length == 1) {
            return memberDate(memberName, parseDate(memberName, parts[0]));
        }
        if (parts.length == 2) {
            return new NgRule(Kind.MEMBER_DATE, memberName,
                    parseDate(memberName, parts[0]), parseDate(memberName, parts[1]), null);
        }
        throw new IllegalArgumentException("Malformed NG entry for " + memberName + ": " + entry);
    }

    private static LocalDate parseDate(String memberName, String text) {
        try {
            return LocalDate.parse(text.strip());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid NG date for " + memberName + ": " + text.strip(), e);
        }
    }

    public boolean isGlobal() {
        return kind == Kind.GLOBAL_DATE;
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean appliesTo(String name) {
        return isGlobal() || memberName.equals(name);
    }

    public String describe() {
        String when = start.equals(end) ? start.toString() : start + "~" + end;
        return reason == null || reason.isBlank() ? when : when + " (" + reason + ")";
    }
}
