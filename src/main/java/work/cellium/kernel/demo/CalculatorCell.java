package work.cellium.kernel.demo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import work.cellium.kernel.bus.EventBus;
import work.cellium.kernel.cell.AbstractCell;
import work.cellium.kernel.cell.ArgumentValue;
import work.cellium.kernel.process.ProcessManager;
import work.cellium.kernel.process.WorkUnit;

/**
 * Arithmetic cell. Every evaluation is announced on the bus as {@code calc.requested} followed by
 * {@code calc.completed} or {@code calc.error}; the cell also listens to those events for its
 * log. Prime counting runs in a worker process.
 */
public final class CalculatorCell extends AbstractCell {
    public static final String REQUESTED = "calc.requested";
    public static final String COMPLETED = "calc.completed";
    public static final String ERROR = "calc.error";
    private static final int HISTORY_SIZE = 10;

    private final EventBus eventBus;
    private final ProcessManager processManager;
    private final Logger log;
    private final Deque<String> history = new ArrayDeque<>();

    public CalculatorCell(EventBus eventBus, ProcessManager processManager, Logger log) {
        super("calculator");
        this.eventBus = eventBus;
        this.processManager = processManager;
        this.log = log;
        command("calc", "Evaluates an arithmetic expression, e.g. calculator:calc:1+2*3", args -> calculate(args.asText()));
        command("eval", "Same as calc", args -> calculate(args.asText()));
        command("primes", "Counts primes below N in a worker process, e.g. calculator:primes:100000", this::countPrimes);
        command("history", "Last " + HISTORY_SIZE + " successful evaluations", args -> history());
        on(REQUESTED, (event, payload) -> log.info("Calculation requested: {}", payload.get("expression")));
        on(COMPLETED, (event, payload) -> log.info("Calculation completed: {} = {}", payload.get("expression"), payload.get("result")));
        on(ERROR, (event, payload) -> log.error("Calculation failed: {} - {}", payload.get("expression"), payload.get("error")));
    }

    String calculate(String expression) {
        eventBus.publish(REQUESTED, Map.of("expression", expression));
        String result;
        try {
            result = ExpressionEvaluator.format(ExpressionEvaluator.evaluate(expression));
        } catch (ArithmeticException | IllegalArgumentException ex) {
            var error = "Error: " + ex.getMessage();
            eventBus.publish(ERROR, Map.of("expression", expression, "error", error));
            return error;
        }
        remember(expression + " = " + result);
        eventBus.publish(COMPLETED, Map.of("expression", expression, "result", result));
        return result;
    }

    private Object countPrimes(ArgumentValue args) {
        var limit = args.asText().trim();
        var result = processManager.submit(WorkUnit.of(PrimeCountTask.class, limit));
        var body = new LinkedHashMap<String, Object>();
        body.put("below", limit);
        body.put("count", result.orElseThrow());
        return body;
    }

    private synchronized void remember(String entry) {
        if (history.size() == HISTORY_SIZE) {
            history.removeFirst();
        }
        history.addLast(entry);
    }

    private synchronized List<String> history() {
        return new ArrayList<>(history);
    }
}
