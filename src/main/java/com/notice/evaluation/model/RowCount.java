package com.notice.evaluation.model;

import lombok.Value;

/** Rows where every field matched, out of the rows considered for one model. */
@Value
public class RowCount {
    int correct;
    int total;
}
