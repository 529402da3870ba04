package com.cajunsystems.aeiou.task;

/**
 * Where the result of a forwarded request goes once an outer handler has answered it.
 */
public enum ResultRouting {
    /** Always into the root's mailbox; the root coordinates its tasks. */
    ROOT,
    /** Into the mailbox of whichever computation issued the request. */
    ISSUER
}
