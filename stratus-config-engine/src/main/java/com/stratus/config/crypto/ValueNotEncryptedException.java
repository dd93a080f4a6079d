package com.stratus.config.crypto;

import com.stratus.config.error.ErrorCode;

public class ValueNotEncryptedException extends DecryptionException {

    public ValueNotEncryptedException() {
        super(ErrorCode.VALUE_NOT_ENCRYPTED, "Value is not encrypted");
    }
}
