package com.example.depositaccrual.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IsoDateDeserializer Tests")
class IsoDateDeserializerTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-02-29",
            "2024-02-29+01:00",
            "2024-02-29T00:00",
            "2024-02-29T23:59:59",
            "2024-02-29T23:00:00.000Z",
            "2024-02-29T10:15:30+02:00[Europe/Berlin]",
            " 2024-02-29 "
    })
    @DisplayName("ISO dates and date-times are truncated to the date as written")
    void parsesIsoForms(String text) {
        assertThat(IsoDateDeserializer.parse(text)).isEqualTo(LocalDate.of(2024, 2, 29));
    }

    @Test
    @DisplayName("Non-ISO dates are rejected")
    void rejectsOtherFormats() {
        assertThatThrownBy(() -> IsoDateDeserializer.parse("29.02.2024"))
                .isInstanceOf(DateTimeParseException.class);
        assertThatThrownBy(() -> IsoDateDeserializer.parse("2023-02-29"))
                .isInstanceOf(DateTimeParseException.class);
    }
}
