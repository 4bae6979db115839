package com.eainde.verify.router;

/**
 * Why an adapter call was downgraded to {@code UNVERIFIABLE}.
 */
public enum AdapterFailure {
    TIMEOUT,
    CRASH
}
