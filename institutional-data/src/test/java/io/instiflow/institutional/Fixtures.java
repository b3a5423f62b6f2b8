package io.instiflow.institutional;

import java.nio.charset.StandardCharsets;

/**
 * Sample exports in the layouts the publishers use.
 */
public final class Fixtures {
    private Fixtures() {}

    /** Foreign investor export: two-level header, with a total row and a trailing note. */
    public static String foreign(String id, String name, String buy, String sell, String net) {
        return "113年01月02日 外資及陸資(不含外資自營商)買賣超彙總表\n"
                + ",證券代號,證券名稱,外資及陸資(不含外資自營商),,,外資自營商,,,外資及陸資,,\n"
                + ",,,買進股數,賣出股數,買賣超股數,買進股數,賣出股數,買賣超股數,買進股數,賣出股數,買賣超股數\n"
                + ",=\"" + id + "\"," + name + ",\"1\",\"1\",\"0\",\"0\",\"0\",\"0\",\"" + buy + "\",\"" + sell + "\",\"" + net + "\"\n"
                + ",=\"2317\",鴻海,\"0\",\"0\",\"0\",\"0\",\"0\",\"0\",\"2,000\",\"3,000\",\"-1,000\"\n"
                + ",合計,,\"9\",\"9\",\"0\",\"0\",\"0\",\"0\",\"9\",\"9\",\"0\"\n"
                + "\n"
                + "說明:\n";
    }

    /** Investment trust export with a header and no rows. */
    public static String trustHeaderOnly() {
        return "113年01月02日 投信買賣超彙總表\n"
                + ",證券代號,證券名稱,買進股數,賣出股數,買賣超股數\n";
    }

    /** Investment trust export with one row per given id. */
    public static String trust(String... ids) {
        StringBuilder sb = new StringBuilder(trustHeaderOnly());
        for (String id : ids) sb.append(",=\"").append(id).append("\",名稱").append(id).append(",\"1,500\",\"500\",\"1,000\"\n");
        return sb.toString();
    }

    /** OTC export: flat header, some columns carrying the unit suffix. */
    public static String otc() {
        return "三大法人買賣明細資訊\n"
                + "資料日期:113/01/02\n"
                + "代號,名稱,外資及陸資買進股數(股),外資及陸資賣出股數(股),外資及陸資買賣超股數(股),投信買進股數,投信賣出股數,投信買賣超股數\n"
                + "=\"6488\",環球晶,\"2,000\",\"1,000\",\"1,000\",0,0,0\n"
                + "=\"3105\",穩懋,\"500\",\"700\",\"-200\",\"100\",0,\"100\"\n"
                + "合計,,\"2,500\",\"1,700\",\"800\",100,0,100\n";
    }

    public static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
