package com.vinow.marketplace.common.exception;

/**
 * ExternalIOException - 데이터스토어 또는 파일 시스템 I/O 실패
 */
public class ExternalIOException extends SystemException {

    public ExternalIOException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }

    public static ExternalIOException datastore(String detailMessage, Throwable cause) {
        return new ExternalIOException(ErrorCode.DATASTORE_ERROR, detailMessage, cause);
    }

    public static ExternalIOException file(String detailMessage, Throwable cause) {
        return new ExternalIOException(ErrorCode.FILE_IO_ERROR, detailMessage, cause);
    }
}
