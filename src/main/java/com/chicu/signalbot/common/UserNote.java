package com.chicu.signalbot.common;

import lombok.experimental.UtilityClass;

/**
 * Свободный текст пользователя (причина отмены / закрытия).
 * Хранится отдельно от кода причины, длина ограничена колонкой.
 */
@UtilityClass
public class UserNote {

    public static final int MAX_LENGTH = 255;

    /** null для пустой строки; слишком длинный текст — IllegalArgumentException (400). */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String t = text.trim();
        if (t.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "reason must be at most " + MAX_LENGTH + " characters, got " + t.length());
        }
        return t;
    }
}
