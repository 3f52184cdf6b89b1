package org.javai.springai.safequery.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.javai.springai.safequery.QueryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each record as one JSON line to the {@code safequery.audit} logger.
 */
public class LoggingAuditSink implements AuditSink {

	public static final String AUDIT_LOGGER = "safequery.audit";

	private static final Logger logger = LoggerFactory.getLogger(AUDIT_LOGGER);

	private final ObjectMapper mapper = new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

	@Override
	public void record(QueryRecord record) {
		logger.info("{}", toJson(record));
	}

	String toJson(QueryRecord record) {
		try {
			return mapper.writeValueAsString(record);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Audit record cannot be serialised: " + e.getOriginalMessage(), e);
		}
	}
}
