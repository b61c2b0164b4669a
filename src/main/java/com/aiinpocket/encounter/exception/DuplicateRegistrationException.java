package com.aiinpocket.encounter.exception;

/**
 * 重複註冊相同 ID（內容資料錯誤，啟動時即中止）。
 */
public class DuplicateRegistrationException extends IllegalStateException {

    public DuplicateRegistrationException(String kind, String id) {
        super(kind + " ID 重複註冊: " + id);
    }
}
