package work.cellium.kernel.process;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Work submitted to the {@link ProcessManager}: a task class name, its arguments and an optional
 * timeout (the manager's default applies when absent).
 */
public record WorkUnit(String task, List<Object> args, Map<String, Object> kwargs, Optional<Duration> timeout) {
    public WorkUnit {
        Objects.requireNonNull(task, "task");
        if (task.isBlank()) {
            throw new IllegalArgumentException("task must not be blank");
        }
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        Objects.requireNonNull(timeout, "timeout");
        timeout.ifPresent(value -> {
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive: " + value);
            }
        });
    }

    public static WorkUnit of(Class<? extends WorkTask> task, Object... args) {
        return builder(task).args(Arrays.asList(args)).build();
    }

    public static Builder builder(Class<? extends WorkTask> task) {
        return new Builder(task.getName());
    }

    public static Builder builder(String task) {
        return new Builder(task);
    }

    public static final class Builder {
        private final String task;
        private List<Object> args = List.of();
        private Map<String, Object> kwargs = Map.of();
        private Optional<Duration> timeout = Optional.empty();

        private Builder(String task) {
            this.task = task;
        }

        public Builder args(List<Object> args) {
            this.args = args;
            return this;
        }

        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Optional.ofNullable(timeout);
            return this;
        }

        public WorkUnit build() {
            return new WorkUnit(task, args, kwargs, timeout);
        }
    }
}
