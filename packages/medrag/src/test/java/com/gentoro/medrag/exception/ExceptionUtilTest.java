package com.gentoro.medrag.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void pipelineErrorsKeepTheirCode() {
    assertEquals(MedRagErrorCode.LLM_ERROR, ExceptionUtil.errorCode(new LlmException("quota")));
    assertEquals(
        MedRagErrorCode.FAILED_PRECONDITION,
        ExceptionUtil.errorCode(new GraphConnectionClosedException("arangodb")));
    assertEquals(
        MedRagErrorCode.UNKNOWN, ExceptionUtil.errorCode(new IllegalStateException("boom")));
  }

  @Test
  void describeFallsBackToTypeName() {
    assertEquals("quota", ExceptionUtil.describe(new LlmException("quota")));
    assertEquals("NullPointerException", ExceptionUtil.describe(new NullPointerException()));
  }

  @Test
  void onlyForeignFailuresAreWrapped() {
    NotFoundException own = new NotFoundException("prompt missing");
    IllegalArgumentException foreign = new IllegalArgumentException("bad yaml");

    assertSame(own, ExceptionUtil.rethrowIfUnchecked(own, e -> new PromptException("x", e)));
    MedRagException wrapped =
        ExceptionUtil.rethrowIfUnchecked(foreign, e -> new PromptException("wrapped", e));
    assertInstanceOf(PromptException.class, wrapped);
    assertSame(foreign, wrapped.getCause());
  }

  @Test
  void detailsAppearInToString() {
    AuthenticationException e =
        new AuthenticationException("key rejected", Map.of("conceptId", "C0004057"));

    assertEquals(Map.of("conceptId", "C0004057"), e.getDetails());
    assertEquals(
        "AuthenticationException[UNAUTHENTICATED]: key rejected {conceptId=C0004057}",
        e.toString());
  }
}
