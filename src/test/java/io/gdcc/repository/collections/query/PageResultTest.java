package io.gdcc.repository.collections.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gdcc.repository.collections.error.InvalidArgumentException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PageResultTest {

    @Test
    @DisplayName("totalPages() rounds up")
    void total_pages_rounds_up() {
        assertThat(new PageResult(0, List.of(), 0, 10).totalPages()).isZero();
        assertThat(new PageResult(10, List.of(), 0, 10).totalPages()).isEqualTo(1);
        assertThat(new PageResult(11, List.of(), 0, 10).totalPages()).isEqualTo(2);
    }

    @Test
    @DisplayName("PageRequest rejects negative pages and non-positive limits")
    void page_request_validation() {
        assertThat(new PageRequest(3, 25).offset()).isEqualTo(75);
        assertThatThrownBy(() -> new PageRequest(-1, 5))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> new PageRequest(0, 0))
                .isInstanceOf(InvalidArgumentException.class);
    }
}
