package com.bit.deposit.aop;

import com.bit.deposit.aop.annotation.Caller;
import com.bit.deposit.aop.annotation.OwnerOnly;
import com.bit.deposit.aop.annotation.WhenNotPaused;
import com.bit.deposit.common.Address;
import com.bit.deposit.error.DepositException;
import com.bit.deposit.gate.AccessGate;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Component;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 统一的访问控制切面：所有者校验、暂停校验，并串行化所有受保护操作
 */
@Slf4j
@Aspect
@Component
public class AccessGateAspect {

    private final AccessGate accessGate;

    public AccessGateAspect(AccessGate accessGate) {
        this.accessGate = accessGate;
    }

    /**
     * 设置切入点 在注解的位置切入代码
     */
    @Pointcut("@annotation(com.bit.deposit.aop.annotation.OwnerOnly)")
    public void ownerOnlyPointCut() {}

    @Pointcut("@annotation(com.bit.deposit.aop.annotation.WhenNotPaused)")
    public void whenNotPausedPointCut() {}


    @Around("ownerOnlyPointCut() || whenNotPausedPointCut()")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        // JDK代理拿到的是接口方法，注解在实现类上
        Method method = AopUtils.getMostSpecificMethod(signature.getMethod(), pjp.getTarget().getClass());
        ReentrantLock lock = accessGate.getExecutionLock();
        lock.lock();
        try {
            if (method.isAnnotationPresent(OwnerOnly.class)) {
                Address caller = resolveCaller(method, pjp.getArgs());
                accessGate.requireOwner(caller);
            }
            if (method.isAnnotationPresent(WhenNotPaused.class)) {
                accessGate.requireNotPaused();
            }
            return pjp.proceed();
        } catch (DepositException e) {
            log.warn("调用被拒绝 | 方法: {} | 原因: {}", method.getName(), e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private Address resolveCaller(Method method, Object[] args) {
        Annotation[][] parameterAnnotations = method.getParameterAnnotations();
        for (int i = 0; i < parameterAnnotations.length; i++) {
            for (Annotation annotation : parameterAnnotations[i]) {
                if (annotation instanceof Caller) {
                    return (Address) args[i];
                }
            }
        }
        throw new IllegalStateException("方法缺少@Caller参数: " + method);
    }
}
