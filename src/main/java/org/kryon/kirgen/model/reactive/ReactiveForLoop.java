package org.kryon.kirgen.model.reactive;

public class ReactiveForLoop {
    public int parentComponentId = -1;
    public String collectionExpression;
    public String itemName;
    public String indexName;
}
