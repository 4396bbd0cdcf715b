package me.go_gradually.phonedesk.domain.disposition;

public enum InfoPrecedence {
    // 이름이 있어도 안내가 끝났으면 PARTIAL보다 먼저 INFO로 본다.
    REGARDLESS_OF_NAME,
    // 이름이 없을 때만 INFO.
    REQUIRE_NO_NAME
}
