package com.zaruka.providers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Classifies by matching the messages of the whole cause chain (plus any HTTP
 * status carried by {@link ModelInvocationException}) against known phrases.
 * A retriable or overflow HTTP status decides first; among phrases, context
 * overflow wins.
 */
public class PatternErrorClassifier implements ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 20;

    private static final List<Pattern> PROMPT_TOO_LONG = List.of(
            Pattern.compile("too (long|large)", Pattern.CASE_INSENSITIVE),
            // "would exceed the rate limit" is throttling, not overflow
            Pattern.compile("exceeds? (?:(?!rate|quota|usage).){0,60}?(limit|maximum)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("max(imum)?[ _]context[ _]length", Pattern.CASE_INSENSITIVE),
            Pattern.compile("context[ _]length[ _]exceeded", Pattern.CASE_INSENSITIVE),
            Pattern.compile("maximum (number of )?tokens", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b413\\b"));

    private static final List<Pattern> RETRIABLE = List.of(
            // rate limiting
            Pattern.compile("\\b429\\b|rate[ _-]?limit|too many requests|quota|resource[ _]exhausted|resource has been exhausted",
                    Pattern.CASE_INSENSITIVE),
            // authorization
            Pattern.compile("\\b40[13]\\b|unauthori[sz]ed|forbidden|authentication|invalid[ _-]?api[ _-]?key",
                    Pattern.CASE_INSENSITIVE),
            // server side
            Pattern.compile("\\b(500|502|503|504|529)\\b|overloaded|service unavailable|bad gateway|internal server error",
                    Pattern.CASE_INSENSITIVE),
            // network
            Pattern.compile("timed? ?out|etimedout|econnreset|econnrefused|econnaborted|connection (reset|refused|closed)"
                    + "|socket hang up|network error", Pattern.CASE_INSENSITIVE));

    @Override
    public ErrorCategory classify(Throwable error) {
        if (error == null) return ErrorCategory.FATAL;
        var chain = causeChain(error);
        for (var t : chain) {
            if (t instanceof CancellationException) return ErrorCategory.FATAL;
        }

        var byStatus = byStatus(chain);
        if (byStatus != null) return byStatus;

        var text = describe(chain);
        if (matchesAny(text, PROMPT_TOO_LONG)) return ErrorCategory.PROMPT_TOO_LONG;
        if (matchesAny(text, RETRIABLE)) return ErrorCategory.RETRIABLE;
        for (var t : chain) {
            if (t instanceof IOException || t instanceof TimeoutException) return ErrorCategory.RETRIABLE;
        }
        return ErrorCategory.FATAL;
    }

    /**
     * An HTTP status from the provider outranks whatever its body says.
     */
    private static ErrorCategory byStatus(List<Throwable> chain) {
        for (var t : chain) {
            if (!(t instanceof ModelInvocationException mie)) continue;
            int status = mie.statusCode();
            if (status == 413) return ErrorCategory.PROMPT_TOO_LONG;
            if (status == 401 || status == 403 || status == 429 || status >= 500) return ErrorCategory.RETRIABLE;
        }
        return null;
    }

    private static List<Throwable> causeChain(Throwable error) {
        var chain = new ArrayList<Throwable>();
        Throwable cur = error;
        while (cur != null && chain.size() < MAX_CAUSE_DEPTH && !chain.contains(cur)) {
            chain.add(cur);
            cur = cur.getCause();
        }
        return chain;
    }

    private static String describe(List<Throwable> chain) {
        var sb = new StringBuilder();
        for (var t : chain) {
            if (t.getMessage() != null) sb.append(t.getMessage()).append(" | ");
            if (t instanceof ModelInvocationException mie && mie.statusCode() > 0) {
                sb.append(mie.statusCode()).append(" | ");
            }
        }
        return sb.toString();
    }

    private static boolean matchesAny(String text, List<Pattern> patterns) {
        for (var p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }
}
