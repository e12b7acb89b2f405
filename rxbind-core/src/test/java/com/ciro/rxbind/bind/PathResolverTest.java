package com.ciro.rxbind.bind;

import com.ciro.rxbind.BindingException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathResolverTest {

    record Street(String name) {}
    record Address(Street street, String city) {}

    public static class User {
        private final Address address;
        private final boolean active;
        public int age = 41;

        public User(Address address, boolean active) {
            this.address = address;
            this.active = active;
        }

        public Address getAddress() { return address; }
        public boolean isActive()   { return active; }
    }

    public static class Exploding {
        public String getBoom() { throw new IllegalStateException("kaboom"); }
    }

    @Test
    void resolvesEachSegmentLikeManualDereference() {
        User user = new User(new Address(new Street("Av. Arce"), "La Paz"), true);

        Object resolved = PathResolver.resolve(user, PropertyPath.parse("address.street.name"));

        assertThat(resolved).isEqualTo(user.getAddress().street().name());
    }

    @Test
    void acceptsCapitalizedMemberNames() {
        User user = new User(new Address(new Street("Prado"), "La Paz"), true);

        assertThat(PathResolver.resolve(user, PropertyPath.parse("Address.City"))).isEqualTo("La Paz");
        assertThat(PathResolver.resolve(user, PropertyPath.parse("Active"))).isEqualTo(true);
        assertThat(PathResolver.resolve(user, PropertyPath.parse("Age"))).isEqualTo(41);
    }

    @Test
    void readsMapKeys() {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("user", new User(null, false));

        assertThat(PathResolver.resolve(ctx, PropertyPath.parse("user.age"))).isEqualTo(41);
    }

    @Test
    void nullIntermediateShortCircuits() {
        User user = new User(new Address(null, "Sucre"), true);

        assertThat(PathResolver.resolve(user, PropertyPath.parse("address.street.name"))).isNull();
        assertThat(PathResolver.resolve(new User(null, true), PropertyPath.parse("address.street.name.whatever"))).isNull();
    }

    @Test
    void missingMemberIsAbsentNotAnError() {
        User user = new User(new Address(new Street("x"), "y"), true);

        assertThat(PathResolver.resolve(user, PropertyPath.parse("address.zip"))).isNull();
        assertThat(PathResolver.resolve(user, PropertyPath.parse("nope.street"))).isNull();
    }

    @Test
    void nullRootIsAbsent() {
        assertThat(PathResolver.resolve(null, PropertyPath.parse("a.b"))).isNull();
    }

    @Test
    void throwingGetterIsAConfigurationError() {
        assertThatThrownBy(() -> PathResolver.resolve(new Exploding(), PropertyPath.parse("boom")))
                .isInstanceOf(BindingException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void membersOfJdkInternalClassesResolveThroughTheirPublicInterface() {
        assertThat(PathResolver.resolve(List.of(1, 2), PropertyPath.parse("Empty"))).isEqualTo(false);
        assertThat(PathResolver.resolve(List.of(1, 2, 3), PropertyPath.parse("size"))).isEqualTo(3);
        assertThat(PathResolver.resolve(Map.of("k", "v").keySet(), PropertyPath.parse("Empty"))).isEqualTo(false);
    }
}
