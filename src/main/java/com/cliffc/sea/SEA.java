package com.cliffc.sea;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/** Parse a tiny imperative language straight into a sea-of-nodes graph of
 *  Regions and Nodes, and print the graph.
 *
 *  Usage: SEA [-nofold] [-debug] [file|-]
 *  With no file, parses a built-in sample program.
 */
public abstract class SEA {
  // Global defaults; each Parse captures DO_FOLD when made
  public static boolean DO_FOLD = true; // Constant folding and branch pruning
  public static boolean DEBUG = false;  // Trace to stderr

  public static final String SAMPLE = """
    {
        int x = READ_INT;
        int y = 10;
        if (x < 2)
        {
            y = y + 3;
        }
        else
        {
            y = y - 3;
        }

        if (y > 10)
        {
            x = x * 2;
        }

        return x + y;
    }
    """;

  public static void main( String[] args ) {
    int rc = go(args);
    if( rc != 0 ) System.exit(rc);
  }

  // Command line program; returns the exit status
  public static int go( String[] args ) {
    boolean fold = DO_FOLD;
    String file = null;
    for( String arg : args ) {
      switch( arg ) {
      case "-nofold" -> fold = false;
      case "-debug"  -> DEBUG = true;
      default -> {
        if( arg.startsWith("-") && arg.length() > 1 ) {
          System.out.println("Unknown flag "+arg);
          System.out.println("Usage: SEA [-nofold] [-debug] [file|-]");
          return 2;
        }
        file = arg;
      }
      }
    }

    String src, prog;
    try {
      if( file==null ) { src = "sample"; prog = SAMPLE; }
      else if( file.equals("-") ) { src = "stdin"; prog = new String(System.in.readAllBytes(),StandardCharsets.UTF_8); }
      else { src = file; prog = Files.readString(Paths.get(file)); }
    } catch( IOException ioe ) {
      System.out.println("Cannot read "+file+": "+ioe.getMessage());
      return 2;
    }

    Graph g = Exec.go(src,prog,fold);
    System.out.print(g);
    return g.ok() ? 0 : 1;
  }

  // Debug printers
  public static <T> T p(T x, String s) {
    if( !DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
