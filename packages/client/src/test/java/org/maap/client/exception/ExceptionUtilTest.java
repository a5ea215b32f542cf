package org.maap.client.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void extractsApiErrorFromCauseChain() {
    RemoteCallException remote = new RemoteCallException("http://x", 400, "queue not found");
    RuntimeException wrapped = new RuntimeException("outer", remote);

    assertEquals("queue not found", ExceptionUtil.extractErrorMessage(wrapped));
  }

  @Test
  void fallsBackToClassNameAndMessage() {
    assertEquals(
        "IOException: connection reset",
        ExceptionUtil.extractErrorMessage(new IOException("connection reset")));
    assertEquals(
        "IllegalStateException", ExceptionUtil.extractErrorMessage(new IllegalStateException()));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  void compactStackTraceLimitsFrames() {
    Exception e = new Exception("x");
    String trace = ExceptionUtil.formatCompactStackTrace(e, 2);

    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName()));
    assertEquals(1, trace.split(" > ").length - 1);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  void exceptionsCarryCodesAndContext() {
    TransferUnauthorizedException e = new TransferUnauthorizedException("https://h/f", 401);

    assertEquals(MaapErrorCode.TRANSFER_UNAUTHORIZED, e.getCode());
    assertEquals("https://h/f", e.getContext().get("url"));
    assertTrue(e instanceof TransferException);
    assertEquals(MaapErrorCode.JOB_FAILED, new JobFailedException("j", "failed").getCode());
  }
}
