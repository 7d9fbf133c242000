package cat2verilog.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map.Entry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file relative path, value: text to write, in order of UpdateContent calls */
  private LinkedHashMap<String, StringBuilder> contents = new LinkedHashMap<>();
  private String base_path = "";
  public FileWriter(String base_path) { this.base_path = base_path; }

  /**
   * Appends text to a file to be written later.
   *
   * @param file The path of the file relative to the base path. The path string should be equal for all updates that target the same file.
   * @param text The text to append; no line break is added.
   */
  public void UpdateContent(String file, String text) { contents.computeIfAbsent(file, file_ -> new StringBuilder()).append(text); }

  /** Returns the pending text for a file, or "" if nothing was registered. */
  public String GetContent(String file) {
    StringBuilder content = contents.get(file);
    return content == null ? "" : content.toString();
  }

  /**
   * Writes all files for which content has been registered, replacing existing files. Missing parent directories are created.
   *
   * @throws IOException if a file cannot be written; files written before the failure remain
   */
  public void WriteFiles() throws IOException {
    for (Entry<String, StringBuilder> entry : contents.entrySet()) {
      WriteFile(entry.getKey(), entry.getValue().toString());
    }
  }

  private void WriteFile(String file, String text) throws IOException {
    Path outFile = Paths.get(base_path, file);
    // create output path if necessary
    if (outFile.getParent() != null)
      Files.createDirectories(outFile.getParent());

    logger.info("Writing " + outFile);
    try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(outFile, StandardCharsets.UTF_8))) {
      out.print(text);
      if (out.checkError())
        throw new IOException("Error writing file " + outFile);
    }
  }
}
