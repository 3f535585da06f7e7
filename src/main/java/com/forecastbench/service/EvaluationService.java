package com.forecastbench.service;

import com.forecastbench.dataset.ForecastCsvReader;
import com.forecastbench.dataset.ForecastTable;
import com.forecastbench.dataset.M4Category;
import com.forecastbench.dataset.M4SeriesInfo;
import com.forecastbench.dataset.SeriesAlignment;
import com.forecastbench.dataset.SeriesGrouping;
import com.forecastbench.dataset.SeriesValues;
import com.forecastbench.dto.CategoryInfoResponse;
import com.forecastbench.dto.EvaluationRequest;
import com.forecastbench.dto.EvaluationResponse;
import com.forecastbench.entity.EvaluationRecord;
import com.forecastbench.exception.EvaluationNotFoundException;
import com.forecastbench.exception.SchemaMismatchException;
import com.forecastbench.repository.EvaluationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final M4SessionProvider    sessionProvider;
    private final BenchmarkScorer      scorer;
    private final EvaluationRepository repository;

    private final ForecastCsvReader csvReader = new ForecastCsvReader();

    @Transactional
    public EvaluationResponse evaluate(EvaluationRequest request, String requestId) {
        List<double[]> forecasts = request.getForecasts().stream()
            .map(SeriesValues::stripInvalid)
            .toList();
        return score(forecasts, request.getLabel(), requestId);
    }

    @Transactional
    public EvaluationResponse evaluateCsv(String csv, String label, String requestId) {
        ForecastTable table;
        try {
            table = csvReader.read(new StringReader(csv));
        } catch (IOException ex) {
            throw new SchemaMismatchException("Forecast csv could not be parsed: " + ex.getMessage());
        }
        SeriesAlignment.check("Forecast csv", table, sessionProvider.getSession().reference());
        return score(table.values(), label, requestId);
    }

    @Transactional(readOnly = true)
    public EvaluationResponse get(UUID evaluationId) {
        return repository.findById(evaluationId)
            .map(this::toResponse)
            .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
    }

    @Transactional(readOnly = true)
    public Page<EvaluationResponse> history(String label, Pageable pageable) {
        Page<EvaluationRecord> page = label != null
            ? repository.findByLabelOrderByCreatedAtDesc(label, pageable)
            : repository.findAllByOrderByCreatedAtDesc(pageable);
        return page.map(this::toResponse);
    }

    public List<CategoryInfoResponse> categories() {
        M4EvaluationSession session = sessionProvider.getSession();
        Map<M4Category, Integer> populations = session.populations();
        List<CategoryInfoResponse> result = new ArrayList<>();
        for (M4Category category : M4Category.values()) {
            List<M4SeriesInfo> members = SeriesGrouping.group(session.reference(), session.categories(), category);
            M4SeriesInfo first = members.isEmpty() ? null : members.get(0);
            result.add(CategoryInfoResponse.builder()
                .category(category.label())
                .role(category.role().name())
                .seriesCount(populations.get(category))
                .horizon(first != null ? first.horizon() : category.horizon())
                .frequency(first != null ? first.frequency() : category.frequency())
                .build());
        }
        return result;
    }

    private EvaluationResponse score(List<double[]> forecasts, String label, String requestId) {
        M4EvaluationSession session = sessionProvider.getSession();
        long started = System.currentTimeMillis();
        M4EvaluationResult result = scorer.evaluate(session, forecasts);

        EvaluationRecord saved = repository.save(EvaluationRecord.builder()
            .label(label)
            .seriesCount(forecasts.size())
            .smape(result.smape())
            .owa(result.owa())
            .requestId(requestId)
            .build());
        log.info("Evaluation stored | id={} | series={} | smapeAvg={} | owaAvg={} | tookMs={} | requestId={}",
            saved.getId(), forecasts.size(), result.smape().get(M4Category.AVERAGE),
            result.owa().get(M4Category.AVERAGE), System.currentTimeMillis() - started, requestId);
        return toResponse(saved);
    }

    private EvaluationResponse toResponse(EvaluationRecord r) {
        return EvaluationResponse.builder()
            .evaluationId(r.getId())
            .label(r.getLabel())
            .seriesCount(r.getSeriesCount())
            .smape(r.getSmape())
            .owa(r.getOwa())
            .createdAt(r.getCreatedAt())
            .requestId(r.getRequestId())
            .build();
    }
}
