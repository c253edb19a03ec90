package com.cypherscan.core.api;

import com.cypherscan.core.model.RemoteEntry;

import java.util.List;

/** 소스 저장소 조회 계약. credential 은 해석하지 않고 그대로 전달한다. */
public interface ISourceClient {

    /** path 가 파일이면 그 파일 하나짜리 목록을 돌려준다. */
    List<RemoteEntry> listDirectory(String repository, String path, String credential);

    byte[] getFileContent(String url, String credential);
}
