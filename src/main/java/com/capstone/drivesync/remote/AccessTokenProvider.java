package com.capstone.drivesync.remote;

/**
 * 원격 드라이브 호출에 쓰는 bearer 토큰 공급자.
 */
public interface AccessTokenProvider {

    // 유효한 토큰을 돌려준다. 만료되었으면 먼저 갱신한다
    String currentToken();

    boolean isValid();

    void refresh();
}
