package com.accesslog.filter;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.accesslog.analyzer.LogRecord;

/**
 * Applies {@link FilterCriteria} to a record list. Predicates are ANDed and
 * the input order is preserved.
 */
public class RecordFilter {

    private static final Logger logger = LoggerFactory.getLogger(RecordFilter.class);

    public static List<LogRecord> apply(List<LogRecord> records, FilterCriteria criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return records;
        }
        Predicate<LogRecord> predicate = toPredicate(criteria);
        return records.stream()
                .filter(predicate)
                .collect(Collectors.toList());
    }

    static Predicate<LogRecord> toPredicate(FilterCriteria criteria) {
        Predicate<LogRecord> predicate = record -> true;

        LocalDate targetDate = criteria.getParsedDate();
        if (targetDate == null && criteria.getDate() != null) {
            logger.debug("Ignoring date filter, not a YYYY-MM-DD date: {}", criteria.getDate());
        }
        if (targetDate != null) {
            predicate = predicate.and(record -> record.getOccurredAt().toLocalDate().equals(targetDate));
        }

        Integer hour = criteria.getHour();
        if (hour != null) {
            predicate = predicate.and(record -> record.getOccurredAt().getHour() == hour);
        }

        String address = criteria.getClientAddress();
        if (address != null) {
            predicate = predicate.and(record -> address.equals(record.getClientAddress()));
        }

        if (criteria.getSoftwareFamily() != null) {
            predicate = predicate.and(record -> record.getSoftwareFamily() == criteria.getSoftwareFamily());
        }
        return predicate;
    }
}
