package com.cypherscan.core.model;

import java.util.Objects;

/** 원격 디렉터리 목록의 한 항목. */
public record RemoteEntry(String name, String path, Type type, String url, String downloadUrl) {

    public enum Type { FILE, DIR, OTHER }

    public RemoteEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
        if (name == null) {
            int slash = path.lastIndexOf('/');
            name = (slash >= 0 ? path.substring(slash + 1) : path);
        }
    }

    public static RemoteEntry file(String path, String url) {
        return new RemoteEntry(null, path, Type.FILE, url, url);
    }

    public static RemoteEntry dir(String path) {
        return new RemoteEntry(null, path, Type.DIR, null, null);
    }

    public boolean isFile() { return type == Type.FILE; }
    public boolean isDir() { return type == Type.DIR; }
}
