package org.deadstore.dataflow.livevariable;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.checkerframework.javacutil.UserError;
import org.deadstore.dataflow.analysis.AbstractAnalysis;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LivenessOptionsTest {

    @Test
    public void defaults() {
        LivenessOptions options = LivenessOptions.fromMap(Collections.<String, String>emptyMap());

        assertThat(options.getWidenAfter())
                .isEqualTo(AbstractAnalysis.DEFAULT_MAX_COUNT_BEFORE_WIDENING);
        assertThat(options.getMaxIterations()).isEqualTo(AbstractAnalysis.DEFAULT_MAX_ITERATIONS);
        assertThat(options.getNoReturnFunctions()).isEmpty();
    }

    @Test
    public void parsesAllOptions() {
        Map<String, String> map = new HashMap<>();
        map.put(LivenessOptions.WIDEN_AFTER, "5");
        map.put(LivenessOptions.MAX_ITERATIONS, " 50 ");
        map.put(LivenessOptions.NO_RETURN_FUNCTIONS, "fail, util.abort,,");
        map.put("unrelated", "ignored");

        LivenessOptions options = LivenessOptions.fromMap(map);

        assertThat(options.getWidenAfter()).isEqualTo(5);
        assertThat(options.getMaxIterations()).isEqualTo(50);
        assertThat(options.getNoReturnFunctions()).containsExactly("fail", "util.abort").inOrder();
    }

    @Test
    public void rejectsNonNumbers() {
        Map<String, String> map = Collections.singletonMap(LivenessOptions.WIDEN_AFTER, "often");
        assertThrows(UserError.class, () -> LivenessOptions.fromMap(map));
    }

    @Test
    public void rejectsNonPositiveNumbers() {
        Map<String, String> map = Collections.singletonMap(LivenessOptions.MAX_ITERATIONS, "0");
        assertThrows(UserError.class, () -> LivenessOptions.fromMap(map));
    }
}
