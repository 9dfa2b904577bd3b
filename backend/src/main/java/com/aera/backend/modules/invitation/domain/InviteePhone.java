package com.aera.backend.modules.invitation.domain;

/**
 * Phone comparison for bound invitations. Only digits count, so {@code +1 (555) 010-2000}
 * and {@code 15550102000} match.
 */
public final class InviteePhone {

    private InviteePhone() {
    }

    public static String normalize(String phone) {
        if (phone == null) {
            return "";
        }
        StringBuilder digits = new StringBuilder(phone.length());
        for (int i = 0; i < phone.length(); i++) {
            char c = phone.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }

    public static boolean matches(String expected, String presented) {
        String left = normalize(expected);
        return !left.isEmpty() && left.equals(normalize(presented));
    }
}
