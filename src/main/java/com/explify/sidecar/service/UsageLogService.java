package com.explify.sidecar.service;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.dto.UsageLogRequest;
import com.explify.sidecar.dto.UsageSummary;
import com.explify.sidecar.model.UsageRecord;
import com.explify.sidecar.model.User;
import com.explify.sidecar.repository.UserRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Model usage accounting: the analysis pipeline reports each completed call, admins read totals.
 */
@Service
public class UsageLogService {
    private static final Logger log = LoggerFactory.getLogger(UsageLogService.class);
    private final MongoTemplate mongoTemplate;
    private final UserRepository userRepository;
    private final AuditWriter auditWriter;
    private final ModeConfig modeConfig;

    public UsageLogService(MongoTemplate mongoTemplate, UserRepository userRepository, AuditWriter auditWriter, ModeConfig modeConfig) {
        this.mongoTemplate = mongoTemplate;
        this.userRepository = userRepository;
        this.auditWriter = auditWriter;
        this.modeConfig = modeConfig;
    }

    /**
     * Queues one usage row. Silently ignored in local mode or without an identity.
     */
    public void recordUsage(String identity, UsageLogRequest request) {
        if (this.modeConfig.isLocal() || identity == null || request == null) {
            return;
        }
        UsageRecord record = UsageRecord.create(identity,
                request.modelUsed(),
                request.inputTokens() != null ? request.inputTokens() : 0,
                request.outputTokens() != null ? request.outputTokens() : 0,
                request.requestType(),
                Boolean.TRUE.equals(request.deepAnalysis()));
        this.auditWriter.submit("usage_log", () -> this.mongoTemplate.insert(record));
    }

    public List<UsageRecord> listForUser(String identity) {
        Query query = new Query(Criteria.where("userId").is(identity));
        query.with(Sort.by(Sort.Direction.DESC, "createdAt"));
        return this.mongoTemplate.find(query, UsageRecord.class);
    }

    /**
     * Usage per user since the given instant, busiest users first.
     */
    public List<UsageSummary> summarizeSince(Instant since) {
        Query query = new Query();
        if (since != null) {
            query.addCriteria(Criteria.where("createdAt").gte(since));
        }
        List<UsageRecord> records = this.mongoTemplate.find(query, UsageRecord.class);
        Map<String, Totals> byUser = new LinkedHashMap<>();
        for (UsageRecord record : records) {
            byUser.computeIfAbsent(record.getUserId(), k -> new Totals()).add(record);
        }
        Map<String, String> emails = new HashMap<>();
        for (User user : this.userRepository.findAllById(byUser.keySet())) {
            emails.put(user.getId(), user.getEmail());
        }
        List<UsageSummary> summaries = new ArrayList<>(byUser.size());
        byUser.forEach((userId, totals) -> summaries.add(totals.toSummary(userId, emails.get(userId))));
        summaries.sort(Comparator.comparingLong(UsageSummary::totalQueries).reversed()
                .thenComparing(UsageSummary::userId, Comparator.nullsLast(Comparator.naturalOrder())));
        log.debug("Usage summary since {}: {} rows over {} users", since, records.size(), summaries.size());
        return summaries;
    }

    private static final class Totals {
        private long queries;
        private long inputTokens;
        private long outputTokens;
        private long sonnet;
        private long opus;
        private long deepAnalysis;
        private Instant lastActive;

        void add(UsageRecord record) {
            this.queries++;
            this.inputTokens += record.getInputTokens();
            this.outputTokens += record.getOutputTokens();
            String model = record.getModelUsed() != null ? record.getModelUsed().toLowerCase(Locale.ROOT) : "";
            if (model.contains("sonnet")) {
                this.sonnet++;
            }
            if (model.contains("opus")) {
                this.opus++;
            }
            if (record.isDeepAnalysis()) {
                this.deepAnalysis++;
            }
            Instant createdAt = record.getCreatedAt();
            if (createdAt != null && (this.lastActive == null || createdAt.isAfter(this.lastActive))) {
                this.lastActive = createdAt;
            }
        }

        UsageSummary toSummary(String userId, String email) {
            return new UsageSummary(userId, email, this.queries, this.inputTokens, this.outputTokens,
                    this.sonnet, this.opus, this.deepAnalysis, this.lastActive);
        }
    }
}
