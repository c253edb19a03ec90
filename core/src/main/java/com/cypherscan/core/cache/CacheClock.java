package com.cypherscan.core.cache;

/** 테스트에서 시간을 고정하기 위한 시계 */
@FunctionalInterface
public interface CacheClock {
    long nowMillis();

    CacheClock SYSTEM = System::currentTimeMillis;
}
