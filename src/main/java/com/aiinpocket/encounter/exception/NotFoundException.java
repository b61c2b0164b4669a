package com.aiinpocket.encounter.exception;

/**
 * 以 ID 查詢原型或組合時找不到對應項目。
 */
public class NotFoundException extends RuntimeException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super("找不到" + kind + ": " + id);
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
