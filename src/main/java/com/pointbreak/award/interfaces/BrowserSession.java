package com.pointbreak.award.interfaces;

/**
 * Opaque handle to one live browser context and its page.
 */
public interface BrowserSession {
    String getId();

    boolean isClosed();
}
