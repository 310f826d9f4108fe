package com.github.spud.sage.domain.rag;

import com.github.spud.sage.domain.loan.Gse;

/**
 * (category, query, gse filter) 检索元组
 */
public record RetrievalQuery(RuleCategory category, String query, Gse gse) {

}
