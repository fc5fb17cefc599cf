package com.flagship.pto_ledger.accrual;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Consumes processed payroll runs and turns them into hours-worked accruals.
 *
 * Offsets are committed manually, only once a run has been applied. Redelivery is harmless:
 * payroll accruals are keyed by run, employee and policy, so a replayed run posts nothing new.
 * A message that can never be applied (bad JSON, invalid payload) is logged and acknowledged.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PayrollEventConsumer {

    private final PayrollAccrualService payrollAccrualService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.payroll:payroll-processed}",
        groupId = "${spring.kafka.consumer.group-id:pto-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received payroll message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        CorrelationContext.setCorrelationId(correlationIdOf(record));
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        try {
            PayrollPayload payload;
            try {
                payload = objectMapper.readValue(record.value(), PayrollPayload.class);
            } catch (JsonProcessingException e) {
                log.warn("Could not parse payroll message at offset {}, acknowledging to skip: {}",
                        record.offset(), e.getOriginalMessage());
                ack.acknowledge();
                return;
            }

            PayrollProcessingResult result;
            try {
                result = payrollAccrualService.processPayroll(payload);
            } catch (ValidationException e) {
                log.warn("Rejected payroll run {} at offset {}, acknowledging to skip: {}",
                        payload.getPayrollRunId(), record.offset(), e.getMessage());
                ack.acknowledge();
                return;
            }

            ack.acknowledge();
            log.info("Processed payroll run: payrollRunId={}, processed={}, accrued={}, skipped={}, errors={}",
                    result.getPayrollRunId(), result.getProcessed(), result.getAccrued(),
                    result.getSkipped(), result.getErrors());

        } catch (RuntimeException e) {
            log.error("Error processing payroll message at offset {}: {}", record.offset(), e.getMessage(), e);
            // Not acknowledged: the run is redelivered.
            throw e;
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private static String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }
}
