package skytiles.acquisition.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import skytiles.acquisition.api.Controller;
import skytiles.acquisition.api.v1.dto.TaskRecordResponse;
import skytiles.acquisition.api.v1.dto.TriggerResponse;
import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.model.TaskRecord;
import skytiles.acquisition.repository.TaskRecordRepository;
import skytiles.acquisition.scheduler.AcquisitionScheduler;
import skytiles.acquisition.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Task records and manual triggers.
 *
 * GET /api/v1/timestamps?limit=N - Recent records, newest first
 * GET /api/v1/timestamps/{id} - One record
 * POST /api/v1/timestamps/{id}/trigger[?force=true] - Run one timestamp now
 */
public class TimestampController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TimestampController.class);

    private static final Pattern LIST_PATTERN = Pattern.compile("^/api/v1/timestamps$");
    private static final Pattern BY_ID_PATTERN = Pattern.compile("^/api/v1/timestamps/([^/]+)$");
    private static final Pattern TRIGGER_PATTERN = Pattern.compile("^/api/v1/timestamps/([^/]+)/trigger$");

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 1000;

    private final TaskRecordRepository repository;
    private final AcquisitionScheduler scheduler;
    private final int maxAttempts;

    public TimestampController(TaskRecordRepository repository, AcquisitionScheduler scheduler, int maxAttempts) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TRIGGER_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return LIST_PATTERN.matcher(path).matches() || BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            QueryStringDecoder query = new QueryStringDecoder(req.uri());

            Matcher triggerMatcher = TRIGGER_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && triggerMatcher.matches()) {
                return handleTrigger(triggerMatcher.group(1), flag(query, "force"));
            }

            if (LIST_PATTERN.matcher(path).matches()) {
                return handleList(query);
            }

            Matcher byIdMatcher = BY_ID_PATTERN.matcher(path);
            if (byIdMatcher.matches()) {
                return handleGet(byIdMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown timestamp endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Timestamp controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * GET /api/v1/timestamps?limit=N
     */
    private ControllerResponse handleList(QueryStringDecoder query) throws Exception {
        int limit = DEFAULT_LIMIT;
        List<String> values = query.parameters().get("limit");
        if (values != null && !values.isEmpty()) {
            try {
                limit = Integer.parseInt(values.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number");
            }
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
            }
        }

        List<TaskRecordResponse> records = repository.findRecent(limit).stream()
                .map(r -> TaskRecordResponse.from(r, maxAttempts))
                .toList();

        Map<String, Object> response = Map.of(
                "count", records.size(),
                "records", records);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/timestamps/{id}
     */
    private ControllerResponse handleGet(String id) throws Exception {
        ImageTimestamp timestamp = ImageTimestamp.parse(id);
        Optional<TaskRecord> record = repository.get(timestamp);
        if (record.isEmpty()) {
            return ControllerResponse.notFound("no record for " + id);
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(TaskRecordResponse.from(record.get(), maxAttempts)));
    }

    /**
     * POST /api/v1/timestamps/{id}/trigger
     */
    private ControllerResponse handleTrigger(String id, boolean force) throws Exception {
        ImageTimestamp timestamp = ImageTimestamp.parse(id);
        if (!scheduler.isAccepting()) {
            return ControllerResponse.unavailable("scheduler is shutting down");
        }

        scheduler.trigger(timestamp, force).whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("Triggered run for {} failed", timestamp, error);
            } else {
                log.info("Triggered run for {} finished: {}", timestamp, outcome);
            }
        });

        return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(TriggerResponse.accepted(timestamp.id(), force)));
    }

    private static boolean flag(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values != null && !values.isEmpty() && Boolean.parseBoolean(values.get(0));
    }
}
