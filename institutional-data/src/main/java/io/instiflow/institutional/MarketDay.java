package io.instiflow.institutional;

import io.instiflow.institutional.parse.MarketTable;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

public record MarketDay(LocalDate date, Map<Market, MarketTable> tables) {
    public MarketDay {
        EnumMap<Market, MarketTable> copy = new EnumMap<>(Market.class);
        for (Market m : Market.values()) copy.put(m, tables.getOrDefault(m, MarketTable.empty()));
        tables = Map.copyOf(copy);
    }

    public MarketTable table(Market market) {
        return tables.get(market);
    }

    public boolean isEmpty() {
        return tables.values().stream().allMatch(MarketTable::isEmpty);
    }
}
