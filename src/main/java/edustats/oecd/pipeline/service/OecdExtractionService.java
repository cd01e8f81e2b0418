package edustats.oecd.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edustats.oecd.pipeline.config.PipelineConfig;
import edustats.oecd.pipeline.dto.DimensionDto;
import edustats.oecd.pipeline.exception.FetchException;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.FlatRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches the SDMX-JSON payload of each dataset and decodes it into flat
 * records.
 *
 * One attempt per dataset, no retries. Consecutive fetches are separated by
 * pipeline.source.request-pause-ms.
 */
@Service
@Slf4j
public class OecdExtractionService {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DimensionDecoder dimensionDecoder;
    private final PipelineConfig config;

    public OecdExtractionService(HttpClient httpClient, ObjectMapper objectMapper,
                                 DimensionDecoder dimensionDecoder, PipelineConfig config) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.dimensionDecoder = dimensionDecoder;
        this.config = config;
    }

    /**
     * Fetch every dataset kind in declaration order.
     *
     * @return flat records per kind
     * @throws FetchException on the first dataset that cannot be fetched
     */
    public Map<DatasetKind, List<FlatRecord>> fetchAll() {
        Map<DatasetKind, List<FlatRecord>> datasets = new EnumMap<>(DatasetKind.class);
        DatasetKind[] kinds = DatasetKind.values();

        for (int i = 0; i < kinds.length; i++) {
            if (i > 0) {
                pause(kinds[i]);
            }
            datasets.put(kinds[i], fetch(kinds[i]));
        }
        return datasets;
    }

    /**
     * Fetch and decode one dataset.
     *
     * @param kind dataset kind
     * @return decoded records, empty when the payload has no observations
     * @throws FetchException if the request fails, returns non-2xx or the body is not JSON
     */
    public List<FlatRecord> fetch(DatasetKind kind) {
        String datasetCode = config.getDatasetCode(kind);
        URI uri = buildUri(kind);
        log.info("Extracting {} data from {}", kind.getKey(), uri);

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(config.getSource().getTimeoutSeconds()))
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("Error fetching dataset {}: {}", datasetCode, e.getMessage());
            throw new FetchException(datasetCode, "Failed to fetch dataset " + datasetCode, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(datasetCode, "Interrupted while fetching dataset " + datasetCode, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.error("Dataset {} returned HTTP {}", datasetCode, status);
            throw new FetchException(datasetCode, status);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            log.error("Dataset {} returned an unreadable body: {}", datasetCode, e.getOriginalMessage());
            throw new FetchException(datasetCode, "Dataset " + datasetCode + " returned invalid JSON", e);
        }

        Map<String, List<Object>> observations = readObservations(root, datasetCode);
        List<DimensionDto> dimensions = readDimensions(root, datasetCode);

        List<FlatRecord> records = dimensionDecoder.decode(observations, dimensions);
        log.info("Extracted {} {} records", records.size(), kind.getKey());
        return records;
    }

    /**
     * {baseUrl}{datasetCode}?dimensionAtObservation=AllDimensions&detail=dataonly&startPeriod&endPeriod
     * plus the kind's extra parameters.
     */
    URI buildUri(DatasetKind kind) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("dimensionAtObservation", "AllDimensions");
        params.put("detail", "dataonly");
        params.put("startPeriod", String.valueOf(config.getYears().getStart()));
        params.put("endPeriod", String.valueOf(config.getYears().getEnd()));
        params.putAll(kind.getExtraParams());

        StringBuilder url = new StringBuilder(config.getSource().getBaseUrl())
                .append(encode(config.getDatasetCode(kind)));
        char separator = '?';
        for (Map.Entry<String, String> param : params.entrySet()) {
            url.append(separator)
                    .append(encode(param.getKey()))
                    .append('=')
                    .append(encode(param.getValue()));
            separator = '&';
        }
        return URI.create(url.toString());
    }

    private Map<String, List<Object>> readObservations(JsonNode root, String datasetCode) {
        JsonNode observationsNode = root.path("dataSets").path(0).path("observations");
        if (!observationsNode.isObject()) {
            log.warn("Dataset {} has no observations", datasetCode);
            return Collections.emptyMap();
        }

        Map<String, List<Object>> observations = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = observationsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<Object> values = new ArrayList<>();
            if (field.getValue().isArray()) {
                for (JsonNode element : field.getValue()) {
                    values.add(objectMapper.convertValue(element, Object.class));
                }
            }
            observations.put(field.getKey(), values);
        }
        return observations;
    }

    private List<DimensionDto> readDimensions(JsonNode root, String datasetCode) {
        JsonNode dimensionsNode = root.path("structure").path("dimensions").path("observation");
        if (!dimensionsNode.isArray()) {
            log.warn("Dataset {} has no observation dimensions", datasetCode);
            return Collections.emptyList();
        }

        List<DimensionDto> dimensions = new ArrayList<>(dimensionsNode.size());
        for (JsonNode node : dimensionsNode) {
            try {
                dimensions.add(objectMapper.treeToValue(node, DimensionDto.class));
            } catch (JsonProcessingException e) {
                throw new FetchException(datasetCode, "Dataset " + datasetCode + " has an unreadable dimension", e);
            }
        }
        return dimensions;
    }

    private void pause(DatasetKind next) {
        long pauseMs = config.getSource().getRequestPauseMs();
        if (pauseMs <= 0) {
            return;
        }
        try {
            Thread.sleep(pauseMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String datasetCode = config.getDatasetCode(next);
            throw new FetchException(datasetCode, "Interrupted before fetching dataset " + datasetCode, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
