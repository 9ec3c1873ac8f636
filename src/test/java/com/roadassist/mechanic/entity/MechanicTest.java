package com.roadassist.mechanic.entity;

import com.roadassist.TestFixtures;
import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MechanicTest {

    @Test
    @DisplayName("A new mechanic is available and occupying flips it to IN_SERVICE")
    void occupyAndRelease() {
        Mechanic mechanic = TestFixtures.mechanic(7L, 70L, 3L);
        assertThat(mechanic.isAvailable()).isTrue();

        mechanic.occupy();
        assertThat(mechanic.getAvailability()).isEqualTo(Availability.IN_SERVICE);

        mechanic.release();
        assertThat(mechanic.getAvailability()).isEqualTo(Availability.AVAILABLE);
    }

    @Test
    @DisplayName("An occupied mechanic cannot be occupied twice")
    void occupyTwice() {
        Mechanic mechanic = TestFixtures.mechanic(7L, 70L, 3L);
        mechanic.occupy();

        assertThatThrownBy(mechanic::occupy)
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.MECHANIC_NOT_AVAILABLE));
    }

    @Test
    @DisplayName("IN_SERVICE is never chosen manually and a mechanic in service cannot toggle")
    void manualToggleRules() {
        Mechanic mechanic = TestFixtures.mechanic(7L, 70L, 3L);

        assertThatThrownBy(() -> mechanic.changeAvailability(Availability.IN_SERVICE))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));

        mechanic.changeAvailability(Availability.NOT_AVAILABLE);
        assertThat(mechanic.isAvailable()).isFalse();
        mechanic.changeAvailability(Availability.AVAILABLE);
        mechanic.occupy();

        assertThatThrownBy(() -> mechanic.changeAvailability(Availability.NOT_AVAILABLE))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.MECHANIC_NOT_AVAILABLE));
        assertThat(mechanic.getAvailability()).isEqualTo(Availability.IN_SERVICE);
    }
}
