package com.cliffc.sea;

/** Thrown to abort a parse.  There is no recovery; {@link Exec} is the only
 *  catcher, and turns it back into an {@link ErrMsg} for the driver. */
public class FatalErr extends RuntimeException {
  public final ErrMsg _err;
  FatalErr( ErrMsg err ) { super(err._msg); _err = err; }
  public ErrMsg.Level level() { return _err._lvl; }
}
