package io.looming.input;

import io.looming.model.Act;
import io.looming.model.GenerationConfig;
import io.looming.model.HistoryRetention;
import io.looming.model.InputKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class BudgetGuardTest {

    @Test
    void rejectsBudgetBelowRatioOfInputSize() {
        BudgetGuard guard = new BudgetGuard(0.1d, 4);
        List<ResolvedContent> contents = List.of(content(2_200));
        Assertions.assertEquals(550L, guard.approximateTokens(contents));
        InputException e = Assertions.assertThrows(InputException.class, () -> guard.check(act(50), contents));
        Assertions.assertEquals(InputException.Kind.BUDGET_TOO_SMALL, e.kind());
    }

    @Test
    void acceptsSufficientOrUnsetBudget() throws Exception {
        BudgetGuard guard = new BudgetGuard(0.1d, 4);
        List<ResolvedContent> contents = List.of(content(2_200));
        guard.check(act(55), contents);
        guard.check(act(null), contents);
        new BudgetGuard(0d, 4).check(act(1), contents);
    }

    private static Act act(Integer maxTokens) {
        return new Act("a", List.of(), new GenerationConfig("echo", null, maxTokens), List.of(), null);
    }

    private static ResolvedContent content(int chars) {
        String text = "x".repeat(chars);
        return new ResolvedContent(InputKind.TEXT, text, null, HistorySummarizer.textSummary(text), HistoryRetention.FULL);
    }
}
