package io.intellixity.collate.imputation;

import java.util.List;

/** Output columns partitioned by whether a null diagnostic found missing values. */
public record ImputationSplit(List<String> imputeColumns, List<String> passThroughColumns) {
  public ImputationSplit {
    imputeColumns = imputeColumns == null ? List.of() : List.copyOf(imputeColumns);
    passThroughColumns = passThroughColumns == null ? List.of() : List.copyOf(passThroughColumns);
  }
}
