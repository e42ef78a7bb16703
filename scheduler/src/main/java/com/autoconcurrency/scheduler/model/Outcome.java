package com.autoconcurrency.scheduler.model;

/**
 * Result of one WorkItem. Produced exactly once per item per run.
 *
 * @param itemId the WorkItem's id
 * @param status final status
 * @param detail failure description ("ExceptionClass: message"); null when PASSED
 */
public record Outcome(String itemId, ItemStatus status, String detail) {

    public static Outcome passed(String itemId) {
        return new Outcome(itemId, ItemStatus.PASSED, null);
    }

    public static Outcome failed(String itemId, Throwable cause) {
        return new Outcome(itemId, ItemStatus.FAILED, describe(cause));
    }

    public static Outcome errored(String itemId, Throwable cause) {
        return new Outcome(itemId, ItemStatus.ERRORED, describe(cause));
    }

    public static Outcome cancelled(String itemId) {
        return new Outcome(itemId, ItemStatus.CANCELLED, "Run cancelled before the item was dispatched");
    }

    public boolean passed() {
        return status == ItemStatus.PASSED;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null
                ? cause.getClass().getName()
                : cause.getClass().getName() + ": " + message;
    }
}
