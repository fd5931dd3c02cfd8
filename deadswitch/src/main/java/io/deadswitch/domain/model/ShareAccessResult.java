package io.deadswitch.domain.model;

/**
 * Outcome of authorizing a server-share read.
 */
public record ShareAccessResult(
        ShareAccessError error, // null when granted
        Secret secret
) {
    public static ShareAccessResult granted(Secret secret) {
        return new ShareAccessResult(null, secret);
    }

    public static ShareAccessResult denied(ShareAccessError error) {
        return new ShareAccessResult(error, null);
    }

    public boolean isGranted() {
        return error == null;
    }
}
