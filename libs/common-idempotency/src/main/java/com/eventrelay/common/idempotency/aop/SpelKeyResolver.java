package com.eventrelay.common.idempotency.aop;

import com.eventrelay.common.idempotency.IdempotencyKeyResolveException;
import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.util.ConcurrentReferenceHashMap;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.util.Map;

public class SpelKeyResolver {

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentReferenceHashMap<>();
    private final ParameterNameDiscoverer paramDiscoverer = new DefaultParameterNameDiscoverer();

    public String resolve(Method method, Object target, Object[] args, String expr) {
        if (!StringUtils.hasText(expr)) {
            throw new IdempotencyKeyResolveException("Key expression is empty on " + method.getName());
        }
        Object value;
        try {
            Expression expression = cache.computeIfAbsent(method.toGenericString() + "#" + expr, k -> parser.parseExpression(expr));
            StandardEvaluationContext context = new MethodBasedEvaluationContext(target, method, args, paramDiscoverer);
            for (int i = 0; i < args.length; i++) {
                context.setVariable("p" + i, args[i]);
            }
            value = expression.getValue(context);
        } catch (Exception e) {
            throw new IdempotencyKeyResolveException("Failed to resolve key expression: " + expr, e);
        }
        if (value == null || !StringUtils.hasText(value.toString())) {
            throw new IdempotencyKeyResolveException("Key expression resolved to nothing: " + expr);
        }
        return value.toString();
    }
}
