package com.docvault.share;

public record ShareValidation(boolean valid, ShareDescriptor share, ShareFailure reason) {

    static ShareValidation ok(ShareDescriptor share) {
        return new ShareValidation(true, share, null);
    }

    static ShareValidation failed(ShareDescriptor share, ShareFailure reason) {
        return new ShareValidation(false, share, reason);
    }
}
