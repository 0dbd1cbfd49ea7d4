package org.codelibs.rcmd;

public class RcmdConstants {

    private RcmdConstants() {
    }

    public static final String ENTITY_ID_FIELD = "entity_id";

    public static final String RECOMMENDED_ITEM_ID_FIELD = "recommended_item_id";

    public static final String SCORE_FIELD = "score";

    public static final String MODEL_TYPE_FIELD = "model_type";

    public static final String UPDATED_AT_FIELD = "updated_at";

    public static final String IS_CURRENT_FIELD = "is_current";

    public static final String SIMILARITY_METRIC = "similarity_metric";

    public static final String TOP_N_RECOMMENDATIONS = "top_n_recommendations";

    public static final String MIN_SUPPORT = "min_support";

    public static final String MAX_ITEMSET_LENGTH = "max_itemset_length";

    public static final String MIN_ITEMSET_LENGTH_FILTER = "min_itemset_length_filter";

    public static final String MIN_BASKET_SIZE = "min_basket_size";

    public static final String TOP_ITEMSETS_PER_CANDIDATE = "top_itemsets_per_candidate";

    public static final int DEFAULT_TOP_N_RECOMMENDATIONS = 6;

    public static final double DEFAULT_MIN_SUPPORT = 0.0001;

    public static final int DEFAULT_MAX_ITEMSET_LENGTH = 10;

    public static final int DEFAULT_MIN_ITEMSET_LENGTH_FILTER = 2;

    public static final int DEFAULT_MIN_BASKET_SIZE = 4;

    public static final int DEFAULT_TOP_ITEMSETS_PER_CANDIDATE = 3;
}
