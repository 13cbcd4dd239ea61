package com.explify.sidecar.service;

import com.explify.sidecar.dto.AdminUserView;
import com.explify.sidecar.dto.BaaAcceptanceEntry;
import com.explify.sidecar.dto.PhiAccessEntry;
import com.explify.sidecar.dto.PhiAccessPage;
import com.explify.sidecar.model.BaaAcceptance;
import com.explify.sidecar.model.PhiAccessRecord;
import com.explify.sidecar.model.User;
import com.explify.sidecar.repository.UserRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Read side of the compliance trails for administrators. Callers must have passed
 * {@link AdminAuthorizer#requireAdmin} first.
 */
@Service
public class AdminReportService {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final MongoTemplate mongoTemplate;
    private final UserRepository userRepository;

    public AdminReportService(MongoTemplate mongoTemplate, UserRepository userRepository) {
        this.mongoTemplate = mongoTemplate;
        this.userRepository = userRepository;
    }

    public List<AdminUserView> listUsers() {
        return this.userRepository.findAll(Sort.by(Sort.Order.desc("lastSignInAt"), Sort.Order.desc("createdAt")))
                .stream()
                .map(AdminUserView::from)
                .collect(Collectors.toList());
    }

    /**
     * One page of the PHI access log, newest first.
     *
     * @param limit clamped to [1, {@value #MAX_LIMIT}]; ignored when {@code unpaged} is set
     */
    public PhiAccessPage phiAccessLog(Instant since, String userId, String action, int limit, int offset, boolean unpaged) {
        Query query = new Query();
        if (since != null) {
            query.addCriteria(Criteria.where("timestamp").gte(since));
        }
        if (userId != null && !userId.isBlank()) {
            query.addCriteria(Criteria.where("userId").is(userId));
        }
        if (action != null && !action.isBlank()) {
            query.addCriteria(Criteria.where("action").is(action));
        }
        long total = this.mongoTemplate.count(query, PhiAccessRecord.class);
        query.with(Sort.by(Sort.Direction.DESC, "timestamp"));
        if (!unpaged) {
            query.skip(Math.max(0, offset));
            query.limit(clampLimit(limit));
        }
        List<PhiAccessRecord> records = this.mongoTemplate.find(query, PhiAccessRecord.class);
        Map<String, String> emails = this.emailsFor(records.stream().map(PhiAccessRecord::getUserId).collect(Collectors.toSet()));
        List<PhiAccessEntry> items = records.stream()
                .map(r -> new PhiAccessEntry(r.getId(), r.getUserId(), emails.get(r.getUserId()), r.getAction(),
                        r.getResourceType(), r.getResourceId(), r.getIpAddress(), r.getUserAgent(), r.getTimestamp()))
                .collect(Collectors.toList());
        return new PhiAccessPage(total, items);
    }

    public List<BaaAcceptanceEntry> baaAcceptances(Instant since, String userId) {
        Query query = new Query();
        if (since != null) {
            query.addCriteria(Criteria.where("acceptedAt").gte(since));
        }
        if (userId != null && !userId.isBlank()) {
            query.addCriteria(Criteria.where("userId").is(userId));
        }
        query.with(Sort.by(Sort.Direction.DESC, "acceptedAt"));
        List<BaaAcceptance> acceptances = this.mongoTemplate.find(query, BaaAcceptance.class);
        Map<String, String> emails = this.emailsFor(acceptances.stream().map(BaaAcceptance::getUserId).collect(Collectors.toSet()));
        return acceptances.stream()
                .map(a -> new BaaAcceptanceEntry(a.getId(), a.getUserId(), emails.get(a.getUserId()), a.getBaaVersion(),
                        a.getAcceptedAt(), a.getIpAddress(), a.getUserAgent()))
                .collect(Collectors.toList());
    }

    public String phiAccessCsv(List<PhiAccessEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append("email,action,resource_type,resource_id,ip_address,user_agent,created_at\n");
        for (PhiAccessEntry entry : entries) {
            sb.append(csv(entry.email()))
              .append(',')
              .append(csv(entry.action()))
              .append(',')
              .append(csv(entry.resourceType()))
              .append(',')
              .append(csv(entry.resourceId()))
              .append(',')
              .append(csv(entry.ipAddress()))
              .append(',')
              .append(csv(entry.userAgent()))
              .append(',')
              .append(csv(entry.createdAt() != null ? entry.createdAt().toString() : ""))
              .append('\n');
        }
        return sb.toString();
    }

    public String baaAcceptanceCsv(List<BaaAcceptanceEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append("email,baa_version,accepted_at,ip_address,user_agent\n");
        for (BaaAcceptanceEntry entry : entries) {
            sb.append(csv(entry.email()))
              .append(',')
              .append(csv(entry.baaVersion()))
              .append(',')
              .append(csv(entry.acceptedAt() != null ? entry.acceptedAt().toString() : ""))
              .append(',')
              .append(csv(entry.ipAddress()))
              .append(',')
              .append(csv(entry.userAgent()))
              .append('\n');
        }
        return sb.toString();
    }

    static int clampLimit(int limit) {
        if (limit < 1) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private Map<String, String> emailsFor(Collection<String> userIds) {
        Set<String> ids = new HashSet<>(userIds);
        ids.remove(null);
        Map<String, String> emails = new HashMap<>();
        if (ids.isEmpty()) {
            return emails;
        }
        for (User user : this.userRepository.findAllById(ids)) {
            emails.put(user.getId(), user.getEmail());
        }
        return emails;
    }

    // Leading formula characters are neutralised so exports are safe to open in a spreadsheet.
    private static String csv(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\r", " ").replace("\n", " ");
        if (!sanitized.isEmpty() && "=+-@".indexOf(sanitized.charAt(0)) >= 0) {
            sanitized = "'" + sanitized;
        }
        if (sanitized.contains(",") || sanitized.contains("\"")) {
            sanitized = sanitized.replace("\"", "\"\"");
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
