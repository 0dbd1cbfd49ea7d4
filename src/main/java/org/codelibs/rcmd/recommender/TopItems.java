/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.codelibs.rcmd.recommender;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Queue;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * <p>
 * A simple class that refactors the "find top N things" logic that is used in several places.
 * Candidates with equal values are ranked by ascending item ID, so the result does not depend on
 * the order candidates are offered in.
 * </p>
 */
public final class TopItems {

    private TopItems() {
    }

    /**
     * @param howMany maximum number of items to return
     * @param possibleItemIDs candidate item IDs
     * @param estimator value of each candidate; {@link Double#NaN} excludes it
     * @return at most {@code howMany} items, highest value first
     */
    public static List<RecommendedItem> getTopItems(final int howMany,
            final long[] possibleItemIDs, final Estimator<Long> estimator) {
        Preconditions.checkArgument(howMany >= 1, "howMany must be at least 1");
        Preconditions.checkArgument(possibleItemIDs != null,
                "possibleItemIDs is null");
        Preconditions.checkArgument(estimator != null, "estimator is null");

        final Comparator<RecommendedItem> comparator = ByValueRecommendedItemComparator
                .getInstance();
        final Queue<RecommendedItem> topItems = new PriorityQueue<RecommendedItem>(
                howMany + 1, Collections.reverseOrder(comparator));
        boolean full = false;
        for (final long itemID : possibleItemIDs) {
            final double value = estimator.estimate(itemID);
            if (Double.isNaN(value)) {
                continue;
            }
            final RecommendedItem item = new GenericRecommendedItem(itemID,
                    value);
            if (!full || comparator.compare(item, topItems.peek()) < 0) {
                topItems.add(item);
                if (full) {
                    topItems.poll();
                } else if (topItems.size() == howMany) {
                    full = true;
                }
            }
        }
        final int size = topItems.size();
        if (size == 0) {
            return Collections.emptyList();
        }
        final List<RecommendedItem> result = Lists
                .newArrayListWithCapacity(size);
        result.addAll(topItems);
        Collections.sort(result, comparator);
        return result;
    }

    public interface Estimator<T> {
        double estimate(T thing);
    }

}
