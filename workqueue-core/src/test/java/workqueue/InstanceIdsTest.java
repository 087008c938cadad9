package workqueue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InstanceIdsTest {

  @Test
  void usesHostnameAndEightHexChars() {
    assertTrue(InstanceIds.generate("worker-host").matches("worker-host-[0-9a-f]{8}"));
  }

  @Test
  void fallsBackToUnknownHost() {
    assertTrue(InstanceIds.generate(null).matches("unknown-[0-9a-f]{8}"));
    assertTrue(InstanceIds.generate("").matches("unknown-[0-9a-f]{8}"));
  }

  @Test
  void idsAreUnique() {
    assertNotEquals(InstanceIds.generate("h"), InstanceIds.generate("h"));
  }

  @Test
  void hostnameNeverNull() {
    assertNotNull(InstanceIds.hostname());
  }
}
