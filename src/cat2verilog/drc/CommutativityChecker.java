package cat2verilog.drc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cat2verilog.frontend.CategoryDescription;
import cat2verilog.frontend.Statement.AssertCommute;

/**
 * Checks the commutativity assertions of a description.
 * <p>
 * Only the presence of the assertion is recorded. Neither path composability (codomain of one morphism matching the domain of the next),
 * matching overall domain/codomain of both paths nor behavioral equality is verified, so every assertion is accepted.
 * A real check needs typed morphisms and a notion of morphism behavior, which the netlist does not model yet.
 */
public class CommutativityChecker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * @return number of assertions checked
   * @throws CommutativityException never thrown at the moment
   */
  public int check(CategoryDescription description) throws CommutativityException {
    int numChecked = 0;
    for (AssertCommute assertion : description.getCommuteAssertions()) {
      logger.info("Checking commutativity: {} == {}", assertion.lhs, assertion.rhs);
      ++numChecked;
    }
    return numChecked;
  }
}
