package com.linesplit.harness;

import com.linesplit.Constants;
import com.linesplit.error.BenchException;
import com.linesplit.error.ErrorType;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class BenchmarkConfigTest {

    @Test
    void shouldDefaultToReferenceBenchmark() {
        var config = BenchmarkConfig.defaults();

        assertThat(config.getLine()).isEqualTo("GET /css/styles.css HTTP/1.1");
        assertThat(config.getIterations()).isEqualTo(20_000_001L);
        assertThat(config.getTrials()).isEqualTo(10);
    }

    @Test
    void shouldUseDefaultsForEmptyProperties() throws BenchException {
        assertThat(BenchmarkConfig.fromProperties(new Properties())).isEqualTo(BenchmarkConfig.defaults());
    }

    @Test
    void shouldApplyPropertyOverrides() throws BenchException {
        var properties = new Properties();
        properties.setProperty(Constants.ITERATIONS_PROPERTY, "1_000_000");
        properties.setProperty(Constants.TRIALS_PROPERTY, " 3 ");
        properties.setProperty(Constants.LINE_PROPERTY, "POST /login HTTP/1.0");

        var config = BenchmarkConfig.fromProperties(properties);

        assertThat(config.getIterations()).isEqualTo(1_000_000L);
        assertThat(config.getTrials()).isEqualTo(3);
        assertThat(config.getLine()).isEqualTo("POST /login HTTP/1.0");
    }

    @Test
    void shouldRejectNonNumericOverride() {
        var properties = new Properties();
        properties.setProperty(Constants.TRIALS_PROPERTY, "ten");

        assertThatThrownBy(() -> BenchmarkConfig.fromProperties(properties))
                .isInstanceOf(BenchException.class)
                .hasMessageContaining(Constants.TRIALS_PROPERTY)
                .extracting(e -> ((BenchException) e).getErrorType())
                .isEqualTo(ErrorType.INVALID_CONFIGURATION);
    }

    @Test
    void shouldRejectNegativeOverride() {
        var properties = new Properties();
        properties.setProperty(Constants.ITERATIONS_PROPERTY, "-1");

        assertThatThrownBy(() -> BenchmarkConfig.fromProperties(properties))
                .isInstanceOf(BenchException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void shouldRejectTrialsThatWouldWrapToPositive() {
        var properties = new Properties();
        properties.setProperty(Constants.TRIALS_PROPERTY, "-4294967286");

        assertThatThrownBy(() -> BenchmarkConfig.fromProperties(properties))
                .isInstanceOf(BenchException.class)
                .hasMessageContaining(Constants.TRIALS_PROPERTY)
                .extracting(e -> ((BenchException) e).getErrorType())
                .isEqualTo(ErrorType.INVALID_CONFIGURATION);
    }

    @Test
    void shouldRejectTrialsBeyondIntRange() {
        var properties = new Properties();
        properties.setProperty(Constants.TRIALS_PROPERTY, "4294967296");

        assertThatThrownBy(() -> BenchmarkConfig.fromProperties(properties))
                .isInstanceOf(BenchException.class)
                .extracting(e -> ((BenchException) e).getErrorType())
                .isEqualTo(ErrorType.INVALID_CONFIGURATION);
    }

    @Test
    void shouldAcceptLargestTrialCount() throws BenchException {
        var properties = new Properties();
        properties.setProperty(Constants.TRIALS_PROPERTY, String.valueOf(Integer.MAX_VALUE));

        assertThat(BenchmarkConfig.fromProperties(properties).getTrials()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void shouldRejectMissingLine() {
        var config = BenchmarkConfig.builder().line(null).build();

        assertThatThrownBy(config::validate).isInstanceOf(BenchException.class);
    }

    @Test
    void toBuilderShouldKeepOtherValues() {
        var config = BenchmarkConfig.defaults().toBuilder().trials(1).build();

        assertThat(config.getTrials()).isEqualTo(1);
        assertThat(config.getIterations()).isEqualTo(Constants.DEFAULT_ITERATIONS);
    }
}
