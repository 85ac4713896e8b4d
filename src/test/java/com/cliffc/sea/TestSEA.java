package com.cliffc.sea;

import org.junit.*;
import org.junit.contrib.java.lang.system.SystemErrRule;
import org.junit.contrib.java.lang.system.SystemOutRule;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import static org.junit.Assert.*;

public class TestSEA {
  // Replace STDOUT/STDERR and track them
  @Rule public final SystemOutRule sysOut = new SystemOutRule().enableLog().muteForSuccessfulTests();
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();
  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  @After public void reset() { SEA.DEBUG = false; }

  private String write( String prog ) throws IOException {
    File f = tmp.newFile("prog.sea");
    Files.writeString(f.toPath(),prog);
    return f.getPath();
  }

  @Test public void testSample() {
    assertEquals(0,SEA.go(new String[0]));
    String out = sysOut.getLog();
    assertTrue(out.contains("Region(Start)"));
    assertTrue(out.contains("Region(End)"));
    assertTrue(out.contains("Phi"));
    assertFalse(out.contains("Sub"));   // y-3 folded
    assertTrue(sysErr.getLog().isEmpty());
  }

  @Test public void testNoFold() {
    assertEquals(0,SEA.go(new String[]{"-nofold"}));
    assertTrue(sysOut.getLog().contains("Sub"));
  }

  @Test public void testFile() throws IOException {
    String path = write("{ return 1 + 2; }");
    assertEquals(0,SEA.go(new String[]{path}));
    String out = sysOut.getLog();
    assertTrue(out.contains("Con 3"));
    assertFalse(out.contains("Add"));
  }

  @Test public void testFileError() throws IOException {
    String path = write("{ int x = 1 }");
    assertEquals(1,SEA.go(new String[]{path}));
    String out = sysOut.getLog();
    assertTrue(out.startsWith(path+":1:Expected ';' but found '}' instead"));
    assertTrue(out.endsWith("^\n"));
  }

  @Test public void testMissingFile() {
    assertEquals(2,SEA.go(new String[]{new File(tmp.getRoot(),"nope.sea").getPath()}));
    assertTrue(sysOut.getLog().startsWith("Cannot read "));
  }

  @Test public void testBadFlag() {
    assertEquals(2,SEA.go(new String[]{"-fast"}));
    assertTrue(sysOut.getLog().startsWith("Unknown flag -fast"));
  }

  @Test public void testDebug() {
    assertEquals(0,SEA.go(new String[]{"-debug"}));
    assertTrue(sysErr.getLog().contains("phi "));
  }
}
