package io.instiflow.institutional;

import io.instiflow.institutional.fetch.DateStyle;
import io.instiflow.institutional.parse.ColumnMapping;
import io.instiflow.institutional.parse.FieldMapping;
import io.instiflow.institutional.parse.SourceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.instiflow.institutional.parse.CanonicalFields.SECURITY_ID;
import static io.instiflow.institutional.parse.CanonicalFields.SECURITY_NAME;

/**
 * The exports fetched for each market, in fetch order. Immutable once built.
 */
public final class PublisherCatalog {
    public static final String TWSE = "TWSE";
    public static final String TPEX = "TPEX";

    private static final String BUY = "買進股數";
    private static final String SELL = "賣出股數";
    private static final String NET = "買賣超股數";

    private final List<SourceDefinition> sources;

    public PublisherCatalog(List<SourceDefinition> sources) {
        this.sources = List.copyOf(sources);
    }

    public List<SourceDefinition> sources() { return sources; }

    public List<SourceDefinition> sourcesFor(Market market) {
        return sources.stream().filter(s -> s.market() == market).toList();
    }

    public static PublisherCatalog defaults() {
        Map<String, String> twseParams = Map.of("response", "csv");
        List<SourceDefinition> list = new ArrayList<>();

        list.add(new SourceDefinition("外資", Market.LISTED, TWSE, "https://www.twse.com.tw/rwd/zh/fund/TWT38U",
                "date", DateStyle.GREGORIAN_COMPACT, twseParams, SourceKind.TWO_LEVEL_HEADER,
                new ColumnMapping(SECURITY_ID, SECURITY_NAME, List.of(
                        FieldMapping.grouped("外資及陸資", BUY, "外資_" + BUY),
                        FieldMapping.grouped("外資及陸資", SELL, "外資_" + SELL),
                        FieldMapping.grouped("外資及陸資", NET, "外資_" + NET)))));

        list.add(new SourceDefinition("投信", Market.LISTED, TWSE, "https://www.twse.com.tw/rwd/zh/fund/TWT44U",
                "date", DateStyle.GREGORIAN_COMPACT, twseParams, SourceKind.SIMPLE,
                new ColumnMapping(SECURITY_ID, SECURITY_NAME, List.of(
                        FieldMapping.of(BUY, "投信_" + BUY),
                        FieldMapping.of(SELL, "投信_" + SELL),
                        FieldMapping.of(NET, "投信_" + NET)))));

        list.add(new SourceDefinition("自營商", Market.LISTED, TWSE, "https://www.twse.com.tw/rwd/zh/fund/TWT43U",
                "date", DateStyle.GREGORIAN_COMPACT, twseParams, SourceKind.TWO_LEVEL_HEADER,
                new ColumnMapping(SECURITY_ID, SECURITY_NAME, List.of(
                        FieldMapping.grouped("自營商(自行買賣)", BUY, "自營商_自行買賣_" + BUY),
                        FieldMapping.grouped("自營商(自行買賣)", SELL, "自營商_自行買賣_" + SELL),
                        FieldMapping.grouped("自營商(自行買賣)", NET, "自營商_自行買賣_" + NET),
                        FieldMapping.grouped("自營商(避險)", BUY, "自營商_避險_" + BUY),
                        FieldMapping.grouped("自營商(避險)", SELL, "自營商_避險_" + SELL),
                        FieldMapping.grouped("自營商(避險)", NET, "自營商_避險_" + NET)))));

        List<FieldMapping> tpexFields = new ArrayList<>();
        for (String group : List.of("外資及陸資", "投信", "自營商(自行買賣)", "自營商(避險)")) {
            for (String measure : List.of(BUY, SELL, NET)) tpexFields.add(FieldMapping.same(group + measure));
        }
        list.add(new SourceDefinition("三大法人", Market.OTC, TPEX,
                "https://www.tpex.org.tw/web/stock/3insti/daily_trade/3itrade_hedge_result.php",
                "d", DateStyle.ROC_SLASHED, Map.of("t", "D", "o", "csv"), SourceKind.FLAT_WITH_SUFFIX,
                new ColumnMapping("代號", "名稱", tpexFields)));

        return new PublisherCatalog(list);
    }
}
