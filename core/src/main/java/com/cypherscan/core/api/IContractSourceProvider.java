package com.cypherscan.core.api;

import com.cypherscan.core.model.SourceFile;

import java.util.List;

/** 온체인 주소 → 검증된 컨트랙트 소스. */
public interface IContractSourceProvider {
    List<SourceFile> fetch(String contractAddress, String chain);
}
