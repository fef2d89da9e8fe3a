package net.agentcharter.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class SystemSettingRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void should_Upsert_When_SavingSetting() {
        SystemSettingRepository repository = new SystemSettingRepository(jdbcTemplate);

        repository.save("AGENT_TAGS_BACKFILL_CURSOR", null);

        verify(jdbcTemplate).update(contains("ON CONFLICT (key) DO UPDATE"), eq("AGENT_TAGS_BACKFILL_CURSOR"), eq(""));
    }

    @Test
    void should_RejectBlankKey_When_Reading() {
        SystemSettingRepository repository = new SystemSettingRepository(jdbcTemplate);

        assertThatThrownBy(() -> repository.find(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
