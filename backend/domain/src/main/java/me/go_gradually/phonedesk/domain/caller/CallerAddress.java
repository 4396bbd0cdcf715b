package me.go_gradually.phonedesk.domain.caller;

import java.util.Optional;

public final class CallerAddress {
    private static final int MIN_LENGTH = 8;

    private CallerAddress() {
    }

    // 발신 번호를 E.164 형태("+" 포함 8자 이상)로 정리한다. 쓸 수 없는 번호면 비어 있다.
    public static Optional<String> normalizeE164(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("+") && trimmed.length() >= MIN_LENGTH
                && trimmed.substring(1).chars().allMatch(Character::isDigit)) {
            return Optional.of(trimmed);
        }
        String digits = trimmed.replaceAll("\\D", "");
        String candidate = "+" + digits;
        if (digits.isEmpty() || candidate.length() < MIN_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
