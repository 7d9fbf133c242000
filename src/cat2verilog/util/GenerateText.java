package cat2verilog.util;

import java.util.EnumMap;

/**
 * Base class for HDL text generation. Subclasses fill the keyword dictionary for their language.
 */
public abstract class GenerateText {
  public String tab = "    ";

  public enum DictWords {
    module,
    endmodule,
    wire,
    assign,
    assign_eq,
    bitsselectRight,
    bitsselectLeft,
    bitsRange,
    in,
    out,
    comment
  }

  public EnumMap<DictWords, String> dictionary = new EnumMap<>(DictWords.class);

  public String GetDictModule() { return dictionary.get(DictWords.module); }

  public String GetDictEndModule() { return dictionary.get(DictWords.endmodule); }

  /** Prefixes every line of text with alignment. A trailing line break is kept as is. */
  public String AlignText(String alignment, String text) {
    String newText = alignment + text;
    newText = newText.replaceAll("(\\r\\n|\\n)(?!$)", "\n" + alignment); // Don't replace trailing newline
    return newText;
  }
}
