package com.eventrelay.common.idempotency.aop;

import com.eventrelay.common.idempotency.Idempotent;
import com.eventrelay.common.idempotency.IdempotencyKeys;
import com.eventrelay.common.idempotency.IdempotencyTemplate;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;

@Aspect
public class IdempotentAspect {

    private static final Logger log = LoggerFactory.getLogger(IdempotentAspect.class);

    private final IdempotencyTemplate template;
    private final SpelKeyResolver keyResolver;

    public IdempotentAspect(IdempotencyTemplate template, SpelKeyResolver keyResolver) {
        this.template = template;
        this.keyResolver = keyResolver;
    }

    @Around("@annotation(idempotent)")
    public Object around(ProceedingJoinPoint pjp, Idempotent idempotent) throws Throwable {
        Method method = ((MethodSignature) pjp.getSignature()).getMethod();
        String id = keyResolver.resolve(method, pjp.getTarget(), pjp.getArgs(), idempotent.key());
        String key = StringUtils.hasText(idempotent.prefix()) ? idempotent.prefix() + ":" + id : id;

        Class<?> returnType = method.getReturnType();
        Class<?> responseType = returnType == Void.TYPE ? Object.class : ClassUtils.resolvePrimitiveIfNecessary(returnType);
        log.debug("Idempotent invocation method={} key={}", method.getName(), IdempotencyKeys.mask(key));
        return template.execute(key, responseType, () -> proceed(pjp));
    }

    @SuppressWarnings("unchecked")
    private static <T> T proceed(ProceedingJoinPoint pjp) throws Exception {
        try {
            return (T) pjp.proceed();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new UndeclaredThrowableException(t);
        }
    }
}
