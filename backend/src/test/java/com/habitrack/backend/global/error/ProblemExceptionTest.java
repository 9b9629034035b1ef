package com.habitrack.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ProblemExceptionTest {

    private Locale previous;

    @BeforeEach
    void useTurkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    void problemTypeIsStableUnderTurkishLocale() {
        ProblemException ex = new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");

        assertThat(ex.getProblemType()).isEqualTo("urn:problem:habitrack:invalid_credentials");
    }

    @Test
    void responseTypeIsStableUnderTurkishLocale() {
        ProblemResponse response = ProblemResponse.of(HttpStatus.FORBIDDEN, "KIOSK_RESTRICTED", null, "/admin/users");

        assertThat(response.type()).isEqualTo("https://habitrack.app/errors/kiosk_restricted");
        assertThat(response.code()).isEqualTo("KIOSK_RESTRICTED");
    }
}
