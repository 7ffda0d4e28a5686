package infrastructure.parallel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathBudgetTest {

    @Test
    void admitsUntilCapThenRefuses() {
        PathBudget budget = new PathBudget(5);

        assertThat(budget.admit(3)).isTrue();
        assertThat(budget.isExhausted()).isFalse();
        assertThat(budget.admit(4)).isTrue();
        assertThat(budget.getAdmitted()).isEqualTo(7);
        assertThat(budget.isExhausted()).isTrue();
        assertThat(budget.admit(1)).isFalse();
        assertThat(budget.getAdmitted()).isEqualTo(7);
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThatThrownBy(() -> new PathBudget(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
