package com.insightreport.generator.service.storage;

import com.insightreport.generator.exception.TransientActivityException;

/**
 * 디스크 I/O 실패. 일시적 오류로 분류되어 재시도된다.
 */
public class StorageException extends TransientActivityException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
