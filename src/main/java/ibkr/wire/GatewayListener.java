package ibkr.wire;

import java.math.BigDecimal;
import java.util.List;

/*
GatewayListener - This is the "incoming" side. TWS responses (market data, order confirmations, errors)
arrive here as method calls, all of them on the single reader thread of the connection.
Implementations must never block.
*/
public interface GatewayListener {

    void nextValidId(int orderId);

    void managedAccounts(String accountsList);

    void connectionClosed();

    void error(int id, int errorCode, String errorMsg, String advancedOrderRejectJson);

    void error(Exception e);

    void historicalData(int reqId, BarMessage bar);

    void historicalDataEnd(int reqId, String startDateStr, String endDateStr);

    void tickPrice(int tickerId, int field, double price);

    void tickSize(int tickerId, int field, BigDecimal size);

    void tickString(int tickerId, int field, String value);

    void tickSnapshotEnd(int reqId);

    void marketDataType(int reqId, int marketDataType);

    void accountSummary(int reqId, String account, String tag, String value, String currency);

    void accountSummaryEnd(int reqId);

    void position(String account, ContractSpec contract, BigDecimal pos, double avgCost);

    void positionEnd();

    void updatePortfolio(ContractSpec contract, BigDecimal position, double marketPrice, double marketValue,
                         double averageCost, double unrealizedPNL, double realizedPNL, String accountName);

    void updateAccountValue(String key, String value, String currency, String accountName);

    void updateAccountTime(String timeStamp);

    void accountDownloadEnd(String accountName);

    void execDetails(int reqId, ContractSpec contract, ExecutionMessage execution);

    void execDetailsEnd(int reqId);

    void openOrder(int orderId, ContractSpec contract, OrderTicket order, String status);

    void openOrderEnd();

    void orderStatus(int orderId, String status, BigDecimal filled, BigDecimal remaining, double avgFillPrice,
                     double lastFillPrice, String whyHeld);

    void contractDetails(int reqId, ContractDetailsMessage contractDetails);

    void contractDetailsEnd(int reqId);

    void symbolSamples(int reqId, List<ContractDescriptionMessage> contractDescriptions);
}
