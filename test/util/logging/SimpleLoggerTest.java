package util.logging;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class SimpleLoggerTest {

  private LogLevel savedRoot;

  @Before
  public void saveRootLevel() {
    savedRoot = LogManager.getRootLevel();
  }

  @After
  public void restoreRootLevel() {
    LogManager.setRootLevel(savedRoot);
  }

  @Test
  public void testFixedLevel() {
    SimpleLogger logger = new SimpleLogger("fixed", LogLevel.WARN);
    assertFalse(logger.isDebugEnabled());
    assertFalse(logger.isInfoEnabled());
    assertTrue(logger.isWarnEnabled());
    assertTrue(logger.isFatalEnabled());
  }

  @Test
  public void testFollowsRootLevel() {
    SimpleLogger logger = new SimpleLogger("follower");
    LogManager.setRootLevel(LogLevel.TRACE);
    assertTrue(logger.isTraceEnabled());
    LogManager.setRootLevel(LogLevel.ERROR);
    assertFalse(logger.isWarnEnabled());
    assertTrue(logger.isErrorEnabled());
  }

  @Test
  public void testPlaceholders() {
    SimpleLogger logger = new SimpleLogger("fmt", LogLevel.INFO);
    assertEquals("a 1 b null", logger.formatMessage("a {} b {}", 1, null));
    assertEquals("a 1 b {}", logger.formatMessage("a {} b {}", 1));
    assertEquals("cost $5", logger.formatMessage("cost {}", "$5"));
    assertEquals("plain", logger.formatMessage("plain"));
  }

  @Test
  public void testLoggersAreShared() {
    Logger first = LogManager.getLogger(SimpleLoggerTest.class);
    assertSame(first, LogManager.getLogger(SimpleLoggerTest.class));
    assertEquals(SimpleLoggerTest.class.getName(), first.getName());
  }

  @Test
  public void testLevelOrder() {
    assertTrue(LogLevel.DEBUG.isLessSpecificThan(LogLevel.INFO));
    assertFalse(LogLevel.ERROR.isLessSpecificThan(LogLevel.WARN));
    assertFalse(LogLevel.INFO.isLessSpecificThan(LogLevel.INFO));
  }
}
