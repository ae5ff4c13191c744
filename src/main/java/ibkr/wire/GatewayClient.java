package ibkr.wire;

import java.io.IOException;

/*
GatewayClient - This is the "outgoing" side. Every method sends one request to TWS/Gateway and returns
immediately; the answer arrives later on the GatewayListener, on the thread that runs processMessages().
*/
public interface GatewayClient {

    void connect(String host, int port, int clientId) throws IOException;

    void disconnect();

    boolean isConnected();

    /**
     * Blocks until inbound messages are available (or the socket closes), then decodes them and
     * invokes the matching {@link GatewayListener} callbacks on the calling thread.
     */
    void processMessages() throws IOException;

    void reqIds();

    /**
     *  1. endDateTime -> "yyyyMMdd HH:mm:ss [TZ]" or "" for now
     *  2. duration -> number + unit (e.g. "30 D", "1 M", "1 Y", "3600 S")
     *  3. barSize -> "1 min", "5 mins", "1 day", ...
     *  4. whatToShow -> "TRADES", "MIDPOINT", "BID", "ASK", ...
     *  5. formatDate -> 1 human readable timestamps, 2 epoch seconds
     */
    void reqHistoricalData(int reqId, ContractSpec contract, String endDateTime, String duration, String barSize,
                           String whatToShow, boolean useRth, int formatDate);

    void cancelHistoricalData(int reqId);

    void reqMarketDataType(int marketDataType);

    void reqMktData(int reqId, ContractSpec contract, String genericTickList, boolean snapshot);

    void cancelMktData(int reqId);

    void reqAccountSummary(int reqId, String group, String tags);

    void cancelAccountSummary(int reqId);

    void reqPositions();

    void cancelPositions();

    void reqAccountUpdates(boolean subscribe, String account);

    void reqExecutions(int reqId, ExecutionFilter filter);

    void reqOpenOrders();

    void reqAllOpenOrders();

    void placeOrder(int orderId, ContractSpec contract, OrderTicket order);

    void cancelOrder(int orderId);

    void reqContractDetails(int reqId, ContractSpec contract);

    void reqMatchingSymbols(int reqId, String pattern);
}
