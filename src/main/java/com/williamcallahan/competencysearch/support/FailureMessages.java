package com.williamcallahan.competencysearch.support;

/**
 * Flattens and bounds exception messages before they reach logs and API error details.
 */
public final class FailureMessages {

    private static final int MAX_FAILURE_DETAIL_LENGTH = 240;

    private FailureMessages() {}

    /**
     * Flattens line breaks and truncates a failure message.
     *
     * @param failureDetails raw message (may be null)
     * @return single-line message of bounded length, empty when absent
     */
    public static String sanitize(String failureDetails) {
        if (failureDetails == null || failureDetails.isBlank()) {
            return "";
        }
        String flattenedFailure =
                failureDetails.replace('\n', ' ').replace('\r', ' ').trim();
        if (flattenedFailure.length() <= MAX_FAILURE_DETAIL_LENGTH) {
            return flattenedFailure;
        }
        return flattenedFailure.substring(0, MAX_FAILURE_DETAIL_LENGTH) + "...";
    }

    /**
     * Describes the root of a failure as {@code Type: message}.
     *
     * @param failure failure to describe
     * @return compact description
     */
    public static String describe(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = sanitize(root.getMessage());
        String typeName = root.getClass().getSimpleName();
        return message.isEmpty() ? typeName : typeName + ": " + message;
    }
}
