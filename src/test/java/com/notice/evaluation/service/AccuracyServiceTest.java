package com.notice.evaluation.service;

import com.notice.evaluation.model.CategoryAccuracy;
import com.notice.evaluation.model.CorrectRowCounts;
import com.notice.evaluation.model.EvaluationDataset;
import com.notice.evaluation.model.ModelScores;
import com.notice.evaluation.model.ModelVariant;
import com.notice.evaluation.model.NoticeCategory;
import com.notice.evaluation.model.NoticeRecord;
import com.notice.evaluation.model.RowCount;
import com.notice.evaluation.repository.NoticeWorkbookStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.notice.evaluation.TestRecords.disconnect;
import static com.notice.evaluation.TestRecords.maintenance;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccuracyServiceTest {

    private static final ModelVariant GEMINI = ModelVariant.GEMINI_2_5_FLASH;
    private static final ModelVariant GPT = ModelVariant.GPT_5_1;
    private static final ModelVariant MINI = ModelVariant.GPT_5_MINI;

    private NoticeWorkbookStore store;
    private AccuracyService service;

    /**
     * Four Master documents. Gemini has all four, identity wrong on d.pdf,
     * notice date off on b.pdf. GPT 5.1 only has a.pdf. GPT 5-mini has nothing.
     */
    private EvaluationDataset dataset;

    @BeforeEach
    void setUp() {
        store = mock(NoticeWorkbookStore.class);
        RecordComparator comparator = new RecordComparator();
        service = new AccuracyService(store, comparator, new ComparisonService(store, comparator));

        Map<String, NoticeRecord> master = new HashMap<>();
        master.put("a.pdf", disconnect("a.pdf"));
        master.put("b.pdf", disconnect("b.pdf").toBuilder().noticeCategory("Late Notice").build());
        master.put("c.pdf", maintenance("c.pdf"));
        master.put("d.pdf", maintenance("d.pdf"));

        Map<String, NoticeRecord> gemini = new HashMap<>();
        gemini.put("a.pdf", disconnect("a.pdf"));
        gemini.put("b.pdf", master.get("b.pdf").toBuilder().noticeDate("2024-03-02").impactAmount("412.80").build());
        gemini.put("c.pdf", maintenance("c.pdf"));
        gemini.put("d.pdf", maintenance("d.pdf").toBuilder().vendorAccountNumber("99999").noticeCategory("Others").build());

        Map<String, NoticeRecord> gpt = Map.of("a.pdf",
                disconnect("a.pdf").toBuilder().impactDate("2024-03-22").build());

        dataset = new EvaluationDataset(master, Map.of(GEMINI, gemini, GPT, gpt));
        when(store.load(anyCollection())).thenReturn(dataset);
    }

    @Nested
    @DisplayName("overallAccuracy")
    class Overall {

        @Test
        void countsIdentityMatchesOverAllMasterDocuments() {
            ModelScores scores = service.overallAccuracy();

            assertThat(scores.get(GEMINI)).isEqualTo(75.0);
            assertThat(scores.get(GPT)).isEqualTo(25.0);
            assertThat(scores.get(MINI)).isEqualTo(0.0);
        }

        @Test
        void emptyMasterScoresZero() {
            ModelScores scores = service.overallAccuracy(EvaluationDataset.empty());

            assertThat(scores.getScores()).hasSize(3).containsValues(0.0);
            assertThat(scores.byKey()).containsOnlyKeys("gemini", "gpt_5_1", "gpt_5_mini");
        }
    }

    @Nested
    @DisplayName("categoryAccuracy")
    class Category {

        @Test
        void scoresEachCategoryAgainstItsMasterCount() {
            CategoryAccuracy accuracy = service.categoryAccuracy();

            assertThat(accuracy.get(GEMINI, NoticeCategory.DISCONNECT_NOTICE)).isEqualTo(100.0);
            assertThat(accuracy.get(GEMINI, NoticeCategory.LATE_NOTICE)).isEqualTo(100.0);
            assertThat(accuracy.get(GEMINI, NoticeCategory.MAINTENANCE)).isEqualTo(50.0);
            assertThat(accuracy.get(GPT, NoticeCategory.DISCONNECT_NOTICE)).isEqualTo(100.0);
            assertThat(accuracy.get(GPT, NoticeCategory.MAINTENANCE)).isEqualTo(0.0);
        }

        @Test
        void categoryWithoutMasterDocumentsIsZero() {
            CategoryAccuracy accuracy = service.categoryAccuracy();

            for (ModelVariant model : ModelVariant.values()) {
                assertThat(accuracy.get(model, NoticeCategory.THIRD_PARTY_AUDIT)).isEqualTo(0.0);
                assertThat(accuracy.get(model, NoticeCategory.RATE_CHANGE)).isEqualTo(0.0);
            }
        }

        @Test
        void listsAreAlignedWithCategoryLabels() {
            CategoryAccuracy accuracy = service.categoryAccuracy();

            assertThat(accuracy.getCategories()).hasSize(9).startsWith("Late Notice").endsWith("Others");
            assertThat(accuracy.byKey()).containsOnlyKeys("gemini_accuracy", "gpt_5_1_accuracy", "gpt_5_mini_accuracy");
            assertThat(accuracy.byKey().get("gpt_5_mini_accuracy")).hasSize(9).containsOnly(0.0);
        }

        @Test
        void unknownMasterLabelCountsAsOthers() {
            NoticeRecord odd = maintenance("x.pdf").toBuilder().noticeCategory("Welcome Letter").build();
            EvaluationDataset data = new EvaluationDataset(
                    Map.of("x.pdf", odd), Map.of(GEMINI, Map.of("x.pdf", odd)));

            CategoryAccuracy accuracy = service.categoryAccuracy(data);

            assertThat(accuracy.get(GEMINI, NoticeCategory.OTHERS)).isEqualTo(100.0);
        }

        @Test
        void comparesCategoryExactly() {
            NoticeRecord truth = maintenance("x.pdf");
            NoticeRecord lower = truth.toBuilder().noticeCategory("maintenance").build();
            EvaluationDataset data = new EvaluationDataset(
                    Map.of("x.pdf", truth), Map.of(GEMINI, Map.of("x.pdf", lower)));

            assertThat(service.categoryAccuracy(data).get(GEMINI, NoticeCategory.MAINTENANCE)).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("impact and notice date accuracy")
    class ExactFields {

        @Test
        void impactAmountUsesRawTextOverImpactBearingDocuments() {
            ModelScores scores = service.impactAmountAccuracy();

            // b.pdf differs only in formatting ("412.80" vs "$412.80") and still counts as wrong
            assertThat(scores.get(GEMINI)).isEqualTo(50.0);
            assertThat(scores.get(GPT)).isEqualTo(50.0);
            assertThat(scores.get(MINI)).isEqualTo(0.0);
        }

        @Test
        void impactDateOverImpactBearingDocuments() {
            ModelScores scores = service.impactDateAccuracy();

            assertThat(scores.get(GEMINI)).isEqualTo(100.0);
            assertThat(scores.get(GPT)).isEqualTo(0.0);
        }

        @Test
        void noImpactBearingDocumentsScoresZero() {
            EvaluationDataset data = new EvaluationDataset(
                    Map.of("c.pdf", maintenance("c.pdf")), Map.of(GEMINI, Map.of("c.pdf", maintenance("c.pdf"))));

            assertThat(service.impactAmountAccuracy(data).get(GEMINI)).isEqualTo(0.0);
            assertThat(service.impactDateAccuracy(data).get(GEMINI)).isEqualTo(0.0);
        }

        @Test
        void noticeDateOverAllDocuments() {
            ModelScores scores = service.noticeDateAccuracy();

            assertThat(scores.get(GEMINI)).isEqualTo(75.0);
            assertThat(scores.get(GPT)).isEqualTo(25.0);
        }

        @Test
        void roundsToOneDecimal() {
            assertThat(AccuracyService.percentage(2, 3)).isEqualTo(66.7);
            assertThat(AccuracyService.percentage(1, 3)).isEqualTo(33.3);
            assertThat(AccuracyService.percentage(5, 0)).isEqualTo(0.0);
        }

        @Test
        void roundsTiesToEven() {
            assertThat(AccuracyService.percentage(1, 16)).isEqualTo(6.2);
            assertThat(AccuracyService.percentage(3, 16)).isEqualTo(18.8);
            assertThat(AccuracyService.percentage(3, 4)).isEqualTo(75.0);
        }
    }

    @Nested
    @DisplayName("correctRowCounts")
    class CorrectRows {

        @Test
        void countsRowsWithEveryFieldMatching() {
            CorrectRowCounts counts = service.correctRowCounts();

            // b.pdf is vendor-correct but its notice date differs, d.pdf is vendor-incorrect
            assertThat(counts.get(GEMINI)).isEqualTo(new RowCount(2, 4));
            assertThat(counts.get(GPT)).isEqualTo(new RowCount(0, 4));
            assertThat(counts.get(MINI)).isEqualTo(new RowCount(0, 4));
        }

        @Test
        void emptyMasterCountsNothing() {
            CorrectRowCounts counts = service.correctRowCounts(EvaluationDataset.empty());

            assertThat(counts.byKey()).containsOnlyKeys("gemini", "gpt_5_1", "gpt_5_mini");
            assertThat(counts.get(GEMINI)).isEqualTo(new RowCount(0, 0));
        }
    }
}
