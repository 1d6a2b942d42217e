package velab.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LoggableTest {
  @Test
  void testRecordAndClear() {
    Loggable log = new Loggable();
    Assertions.assertFalse(log.error());
    log.warn("unused wire w");
    Assertions.assertTrue(log.warning());
    Assertions.assertFalse(log.error());

    log.error(ErrorKind.DuplicateDeclaration, "M");
    log.error("bad");
    Assertions.assertTrue(log.error(ErrorKind.DuplicateDeclaration));
    Assertions.assertTrue(log.error(ErrorKind.SemanticError));
    Assertions.assertFalse(log.error(ErrorKind.MissingRootDeclaration));
    Assertions.assertEquals(2, log.getErrors().size());
    Assertions.assertEquals(Diagnostic.Severity.WARNING, log.getWarnings().get(0).severity());

    log.clearLogs();
    Assertions.assertFalse(log.error());
    Assertions.assertFalse(log.warning());
  }

  @Test
  void testCopyLogs() {
    Loggable a = new Loggable();
    Loggable b = new Loggable();
    b.error(ErrorKind.MissingRootDeclaration, "no root");
    b.warn("w");
    a.copyLogs(b);
    Assertions.assertTrue(a.error(ErrorKind.MissingRootDeclaration));
    Assertions.assertEquals("no root", a.getErrors().get(0).message());
    Assertions.assertEquals(1, a.getWarnings().size());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> a.getErrors().clear());
  }
}
