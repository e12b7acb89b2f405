package com.ciro.rxbind.bind;

import com.ciro.rxbind.BindingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectiveParserTest {

    private final DirectiveParser parser = new DirectiveParser();

    @Test
    void positionalPath() {
        BindingDirective d = parser.parse("{bind Count}");

        assertThat(d.path()).isEqualTo(PropertyPath.parse("Count"));
        assertThat(d.mode()).isEqualTo(BindingMode.DEFAULT);
        assertThat(d.state()).isEqualTo(BindingDirective.State.UNATTACHED);
    }

    @Test
    void pathAndModeOptions() {
        BindingDirective d = parser.parse("{ bind Path=User.Name , mode=OneTime }");

        assertThat(d.path().segments()).containsExactly("User", "Name");
        assertThat(d.mode()).isEqualTo(BindingMode.ONE_TIME);
    }

    @Test
    void positionalPathWithMode() {
        BindingDirective d = parser.parse("{bind User.Age, Mode=TwoWay}");

        assertThat(d.path()).hasToString("User.Age");
        assertThat(d.mode()).isEqualTo(BindingMode.TWO_WAY);
    }

    @Test
    void recognizesOnlyItsKeyword() {
        assertThat(parser.isDirective("{bind X}")).isTrue();
        assertThat(parser.isDirective("{Bind X}")).isTrue();
        assertThat(parser.isDirective("{binding X}")).isFalse();
        assertThat(parser.isDirective("bind X")).isFalse();
        assertThat(parser.isDirective("hola")).isFalse();
        assertThat(parser.isDirective(null)).isFalse();
    }

    @Test
    void customKeyword() {
        DirectiveParser rx = new DirectiveParser("rx");

        assertThat(rx.isDirective("{rx Count}")).isTrue();
        assertThat(rx.isDirective("{bind Count}")).isFalse();
        assertThat(rx.parse("{rx Count}").path()).hasToString("Count");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{bind}",
            "{bind Mode=OneWay}",
            "{bind A, B}",
            "{bind A, Foo=1}",
            "{bind A, Mode=Sideways}",
            "{bind A..B}",
            "{bind A,}",
            "{bind A, Path=B}",
            "not a directive"
    })
    void malformedDirectivesAreConfigurationErrors(String text) {
        assertThatThrownBy(() -> parser.parse(text)).isInstanceOf(BindingException.class);
    }

    @Test
    void rejectsInvalidKeyword() {
        assertThatThrownBy(() -> new DirectiveParser("{x")).isInstanceOf(IllegalArgumentException.class);
    }
}
