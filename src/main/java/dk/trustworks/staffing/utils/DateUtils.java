package dk.trustworks.staffing.utils;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

public final class DateUtils {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("uuuu-MM");

    private DateUtils() {
    }

    public static boolean isWeekendDay(LocalDate localDate) {
        return localDate.getDayOfWeek().equals(DayOfWeek.SATURDAY) || localDate.getDayOfWeek().equals(DayOfWeek.SUNDAY);
    }

    public static LocalDate getFirstDayOfMonth(YearMonth month) {
        return month.atDay(1);
    }

    public static LocalDate getLastDayOfMonth(YearMonth month) {
        return month.atEndOfMonth();
    }

    /**
     * Every calendar month touched by the period, in order.
     *
     * @param from inclusive
     * @param to inclusive
     */
    public static List<YearMonth> getMonthsInPeriod(LocalDate from, LocalDate to) {
        List<YearMonth> months = new ArrayList<>();
        if (from.isAfter(to)) return months;
        YearMonth month = YearMonth.from(from);
        YearMonth last = YearMonth.from(to);
        while (!month.isAfter(last)) {
            months.add(month);
            month = month.plusMonths(1);
        }
        return months;
    }

    public static LocalDate max(LocalDate a, LocalDate b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    public static LocalDate min(LocalDate a, LocalDate b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    public static String stringIt(LocalDate date) {
        return date.format(ISO_DATE);
    }

    public static String monthKey(YearMonth month) {
        return month.format(MONTH_KEY);
    }

    /**
     * Strict ISO parsing, {@code 2024-6-3} and {@code 2024-02-30} are rejected.
     */
    public static LocalDate dateIt(String date) {
        if(date==null || date.isBlank()) return null;
        return LocalDate.parse(date.trim(), ISO_DATE);
    }
}
