package com.toolguard.audit;

public record FilesystemWriteResult(boolean isWrite, String targetPath) {

    private static final FilesystemWriteResult NOT_A_WRITE = new FilesystemWriteResult(false, null);

    public static FilesystemWriteResult notAWrite() {
        return NOT_A_WRITE;
    }

    public static FilesystemWriteResult write(String targetPath) {
        return new FilesystemWriteResult(true, targetPath);
    }
}
