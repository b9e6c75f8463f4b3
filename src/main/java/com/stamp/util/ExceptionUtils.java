package com.stamp.util;

import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Formatting of throwables for logs and for the messages of failed jobs.
 */
public abstract class ExceptionUtils {

    /**
     * The full stack trace including causes. Only for the log: it contains linefeeds and tabs and should never be
     * shown to the person who submitted a job.
     */
    public static String stackTraceString (Throwable throwable) {
        return Throwables.getStackTraceAsString(throwable);
    }

    /**
     * One line naming each throwable in the cause chain with its message, root cause first, e.g.
     * "EOFException: truncated header, caused CorruptFileException: x.fits". Cycles in the chain are cut.
     */
    public static String shortCauseString (Throwable throwable) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Sets.newIdentityHashSet();
        for (Throwable t = throwable; t != null && seen.add(t); t = t.getCause()) {
            chain.add(t);
        }
        return Lists.reverse(chain).stream()
            .map(ExceptionUtils::describe)
            .collect(Collectors.joining(", caused "));
    }

    private static String describe (Throwable throwable) {
        String name = throwable.getClass().getSimpleName();
        return throwable.getMessage() == null ? name : name + ": " + throwable.getMessage();
    }

}
