package com.example.demo.shortcuts.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.Signature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class LogExecutionTimeAspectTest {

    private final LogExecutionTimeAspect aspect = new LogExecutionTimeAspect();
    private ProceedingJoinPoint joinPoint;

    static class Timed {
        @LogExecutionTime("Labelled Work")
        void labelled() {
        }

        @LogExecutionTime
        void unlabelled() {
        }
    }

    private static LogExecutionTime annotationOf(String method) throws NoSuchMethodException {
        return Timed.class.getDeclaredMethod(method).getAnnotation(LogExecutionTime.class);
    }

    @BeforeEach
    public void setup() {
        joinPoint = mock(ProceedingJoinPoint.class);
    }

    @Test
    public void testReturnsResultOfProceed() throws Throwable {
        when(joinPoint.proceed()).thenReturn("built");

        Object result = aspect.logExecutionTime(joinPoint, annotationOf("labelled"));

        assertEquals("built", result);
        verify(joinPoint).proceed();
        verify(joinPoint, never()).getSignature();
    }

    @Test
    public void testFallsBackToSignatureLabel() throws Throwable {
        Signature signature = mock(Signature.class);
        when(signature.toShortString()).thenReturn("Timed.unlabelled()");
        when(joinPoint.getSignature()).thenReturn(signature);
        when(joinPoint.proceed()).thenReturn(null);

        assertNull(aspect.logExecutionTime(joinPoint, annotationOf("unlabelled")));
        verify(signature).toShortString();
    }

    @Test
    public void testExceptionsPropagate() throws Throwable {
        when(joinPoint.proceed()).thenThrow(new IllegalStateException("failed"));

        assertThrows(IllegalStateException.class,
                () -> aspect.logExecutionTime(joinPoint, annotationOf("labelled")));
    }
}
