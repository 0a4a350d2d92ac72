package com.sitesearch.export;

/**
 * Receives failure notices meant for a person watching an interactive run.
 */
public interface UserNotifier {

    /** Notifier for batch runs; failures are only logged. */
    UserNotifier NONE = (title, message) -> { };

    void notify(String title, String message);
}
