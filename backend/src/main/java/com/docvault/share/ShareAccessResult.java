package com.docvault.share;

public record ShareAccessResult(boolean success, ShareDescriptor share, ShareFailure reason) {

    static ShareAccessResult granted(ShareDescriptor share) {
        return new ShareAccessResult(true, share, null);
    }

    static ShareAccessResult failed(ShareDescriptor share, ShareFailure reason) {
        return new ShareAccessResult(false, share, reason);
    }
}
