package com.ciro.rxbind.bind;

import com.ciro.rxbind.BindingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BindingModeTest {

    @ParameterizedTest
    @CsvSource({
            "OneTime, ONE_TIME",
            "oneway, ONE_WAY",
            "OneWayToSource, ONE_WAY_TO_SOURCE",
            "two_way, TWO_WAY",
            "TWO-WAY, TWO_WAY",
            "Default, DEFAULT"
    })
    void parsesMarkupSpellings(String text, BindingMode expected) {
        assertThat(BindingMode.parse(text)).isEqualTo(expected);
    }

    @Test
    void directionTable() {
        assertThat(BindingMode.ONE_TIME.listens()).isTrue();
        assertThat(BindingMode.ONE_TIME.emits()).isFalse();
        assertThat(BindingMode.ONE_WAY.listens()).isTrue();
        assertThat(BindingMode.ONE_WAY.emits()).isFalse();
        assertThat(BindingMode.ONE_WAY_TO_SOURCE.listens()).isFalse();
        assertThat(BindingMode.ONE_WAY_TO_SOURCE.emits()).isTrue();
        assertThat(BindingMode.TWO_WAY.listens()).isTrue();
        assertThat(BindingMode.TWO_WAY.emits()).isTrue();
    }

    @Test
    void unknownMode() {
        assertThatThrownBy(() -> BindingMode.parse("Sideways")).isInstanceOf(BindingException.class);
    }
}
