package fsmgen.ui;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FSMGenConfigTest {
  private File resource(String name) throws Exception { return new File(getClass().getResource("/configs/" + name).toURI()); }

  @Test
  void testDefaults() {
    FSMGenConfig cfg = new FSMGenConfig();
    Assertions.assertFalse(cfg.dump_fsm);
    Assertions.assertFalse(cfg.force);
    Assertions.assertFalse(cfg.early_transitions);
    Assertions.assertTrue(cfg.denest_loops);
    Assertions.assertTrue(cfg.order_dataflow);
  }

  @Test
  void testLoadTagged() throws Exception {
    FSMGenConfig cfg = FSMGenConfig.load(resource("fsmgen.yaml"));
    Assertions.assertTrue(cfg.dump_fsm);
    Assertions.assertTrue(cfg.early_transitions);
    Assertions.assertFalse(cfg.order_dataflow);
    // not in the file
    Assertions.assertFalse(cfg.force);
    Assertions.assertTrue(cfg.denest_loops);
  }

  @Test
  void testLoadPlain() throws Exception {
    FSMGenConfig cfg = FSMGenConfig.load(resource("plain.yaml"));
    Assertions.assertTrue(cfg.force);
    Assertions.assertFalse(cfg.denest_loops);
    Assertions.assertFalse(cfg.dump_fsm);
  }

  @Test
  void testFallback(@TempDir Path tmp) throws Exception {
    String defaults = new FSMGenConfig().toString();
    Assertions.assertEquals(defaults, FSMGenConfig.load(tmp.resolve("missing.yaml").toFile()).toString());

    Path empty = Files.writeString(tmp.resolve("empty.yaml"), "");
    Assertions.assertEquals(defaults, FSMGenConfig.load(empty.toFile()).toString());

    Path unknown = Files.writeString(tmp.resolve("unknown.yaml"), "no_such_option: true\n");
    Assertions.assertEquals(defaults, FSMGenConfig.load(unknown.toFile()).toString());
  }
}
