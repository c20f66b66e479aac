package com.dcruver.goldenset.app;

import com.dcruver.goldenset.domain.IntegrityCheckException;
import com.dcruver.goldenset.domain.topup.QuotaUnmetException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.command.CommandExceptionResolver;
import org.springframework.shell.command.CommandHandlingResult;
import org.springframework.stereotype.Component;

/**
 * Maps fatal curation failures to process exit codes in non-interactive runs.
 * An unmet quota exits with 2, a failed integrity check with 3.
 */
@Component
@Slf4j
public class CurationExceptionResolver implements CommandExceptionResolver {

    public static final int QUOTA_UNMET_EXIT = 2;
    public static final int INTEGRITY_EXIT = 3;

    @Override
    public CommandHandlingResult resolve(Exception ex) {
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof QuotaUnmetException quota) {
                log.error("Quota unmet: {}", quota.getMessage());
                return CommandHandlingResult.of(quota.getMessage() + "\n", QUOTA_UNMET_EXIT);
            }
            if (cause instanceof IntegrityCheckException integrity) {
                log.error("Integrity check failed: {}", integrity.getMessage());
                StringBuilder sb = new StringBuilder("Integrity check failed:\n");
                integrity.getFailures().forEach(p -> sb.append("- ").append(p).append("\n"));
                return CommandHandlingResult.of(sb.toString(), INTEGRITY_EXIT);
            }
            cause = cause.getCause();
        }
        return null;
    }
}
