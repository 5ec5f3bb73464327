package com.milkledger.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Logging aspect for method execution logging.
 *
 * Automatically logs:
 * - Service method entry with parameters, exit with return value, timing
 * - Controller call timing
 * - Repository calls at DEBUG
 * - Exceptions (type and message)
 *
 * Parameters whose name contains password, token or secret are logged as
 * [REDACTED]. Names come from the compiled parameter table, which is why
 * the build passes -parameters to javac.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    static final String REDACTED = "[REDACTED]";

    private static final Set<String> SENSITIVE_NAME_PARTS = Set.of("password", "token", "secret");

    /**
     * Log all service method calls with parameters and execution time.
     */
    @Around("execution(* com.milkledger.service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();
        Object[] args = joinPoint.getArgs();

        String executionId = generateExecutionId();
        MDC.put("executionId", executionId);

        log.info("╔══════════════════════════════════════════════════════════════");
        log.info("║ SERVICE CALL: {}.{}", className, methodName);
        log.info("║ Execution ID: {}", executionId);

        if (args != null && args.length > 0) {
            log.info("║ Parameters:");
            String[] paramNames = signature.getParameterNames();
            for (int i = 0; i < args.length; i++) {
                String paramName = (paramNames != null && i < paramNames.length) ? paramNames[i] : "arg" + i;
                log.info("║   - {}: {}", paramName, formatParameter(paramName, args[i]));
            }
        } else {
            log.info("║ Parameters: (none)");
        }
        log.info("╠══════════════════════════════════════════════════════════════");

        long startTime = System.currentTimeMillis();
        boolean success = false;

        try {
            Object result = joinPoint.proceed();
            success = true;
            log.info("║ ✓ SUCCESS");
            log.info("║ Return Value: {}", formatParameter("result", result));
            return result;

        } catch (Exception e) {
            log.error("║ ✗ EXCEPTION THROWN");
            log.error("║ Exception Type: {}", e.getClass().getSimpleName());
            log.error("║ Exception Message: {}", e.getMessage());
            throw e;

        } finally {
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("║ Execution Time: {} ms ({})", executionTime, success ? "ok" : "failed");
            log.info("╚══════════════════════════════════════════════════════════════");

            if (executionTime > 1000) {
                log.warn("⚠ SLOW OPERATION: {}.{} took {} ms", className, methodName, executionTime);
            }

            MDC.remove("executionId");
        }
    }

    /**
     * Log all controller method calls (lighter logging than services).
     */
    @Around("execution(* com.milkledger.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        log.info("→ HTTP REQUEST: {}.{}", className, methodName);

        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("← HTTP RESPONSE: {}.{} completed in {} ms", className, methodName, executionTime);
            return result;

        } catch (Exception e) {
            long executionTime = System.currentTimeMillis() - startTime;
            log.warn("← HTTP ERROR: {}.{} failed after {} ms - {}: {}",
                     className, methodName, executionTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    /**
     * Log repository method calls for debugging database operations.
     */
    @Around("execution(* com.milkledger.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        if (log.isDebugEnabled()) {
            Object[] args = joinPoint.getArgs();
            String[] paramNames = signature.getParameterNames();
            StringBuilder params = new StringBuilder();
            for (int i = 0; args != null && i < args.length; i++) {
                String paramName = (paramNames != null && i < paramNames.length) ? paramNames[i] : "arg" + i;
                if (i > 0) {
                    params.append(", ");
                }
                params.append(paramName).append('=').append(formatParameter(paramName, args[i]));
            }
            log.debug("DB CALL: {}.{}({})", className, methodName, params);
        }

        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;

            log.debug("DB RETURN: {}.{} completed in {} ms", className, methodName, executionTime);

            if (executionTime > 500) {
                log.warn("⚠ SLOW QUERY: {}.{} took {} ms", className, methodName, executionTime);
            }

            return result;

        } catch (Exception e) {
            log.error("DB ERROR: {}.{} - {}: {}", className, methodName, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    /**
     * Format parameter for logging: mask sensitive names, truncate long values.
     */
    static String formatParameter(String name, Object value) {
        if (value == null) {
            return "null";
        }
        if (isSensitive(name)) {
            return REDACTED;
        }

        String text = value.toString();
        if (text.length() > 100) {
            return text.substring(0, 97) + "...";
        }
        return text;
    }

    static boolean isSensitive(String name) {
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return SENSITIVE_NAME_PARTS.stream().anyMatch(lower::contains);
    }

    private String generateExecutionId() {
        return String.format("%d-%d", System.currentTimeMillis(), Thread.currentThread().getId());
    }
}
