package io.doncoin.indexer.eth;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Array;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.BytesType;
import org.web3j.abi.datatypes.NumericType;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthGetCode;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.http.HttpService;
import org.web3j.utils.Numeric;

public class Web3jRpcClient implements ChainRpcClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jRpcClient.class);

    private final Web3j web3j;

    public Web3jRpcClient(Web3j web3j) {
        this.web3j = web3j;
    }

    public static Web3jRpcClient create(String rpcUrl, long timeoutMs) {
        Duration timeout = Duration.ofMillis(timeoutMs);
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .build();
        return new Web3jRpcClient(Web3j.build(new HttpService(rpcUrl, httpClient)));
    }

    @Override
    public long currentBlockHeight() throws IOException {
        EthBlockNumber response = web3j.ethBlockNumber().send();
        ensureSuccess("eth_blockNumber", response);
        return response.getBlockNumber().longValueExact();
    }

    @Override
    public byte[] getCode(String address, long blockNumber) throws IOException {
        EthGetCode response = web3j
            .ethGetCode(address, DefaultBlockParameter.valueOf(BigInteger.valueOf(blockNumber)))
            .send();
        ensureSuccess("eth_getCode", response);
        String code = response.getCode();
        if (code == null || code.isBlank() || "0x".equalsIgnoreCase(code.trim())) {
            return new byte[0];
        }
        return Numeric.hexStringToByteArray(code);
    }

    @Override
    public BlockHeader getBlock(long blockNumber) throws IOException {
        EthBlock response = web3j
            .ethGetBlockByNumber(DefaultBlockParameter.valueOf(BigInteger.valueOf(blockNumber)), false)
            .send();
        ensureSuccess("eth_getBlockByNumber", response);
        EthBlock.Block block = response.getBlock();
        if (block == null) {
            throw new IOException("Missing block for number: " + blockNumber);
        }
        return new BlockHeader(
            block.getNumber().longValueExact(),
            block.getHash(),
            Instant.ofEpochSecond(block.getTimestamp().longValue())
        );
    }

    @Override
    public List<EventLog> getEventLogs(
        String contractName,
        String contractAddress,
        AbiEventDefinition event,
        long fromBlock,
        long toBlock
    ) throws IOException {
        EthFilter filter = new EthFilter(
            DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
            DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
            contractAddress
        );
        filter.addSingleTopic(event.topic0());

        EthLog response = web3j.ethGetLogs(filter).send();
        ensureSuccess("eth_getLogs", response);

        List<EventLog> logs = new ArrayList<>();
        for (EthLog.LogResult<?> result : response.getLogs()) {
            Log chainLog = (Log) result.get();
            if (chainLog.isRemoved()) {
                continue;
            }
            logs.add(toEventLog(contractName, event, chainLog));
        }
        logs.sort(Comparator.comparingLong(EventLog::blockNumber).thenComparingLong(EventLog::logIndex));
        return logs;
    }

    @Override
    public void close() {
        web3j.shutdown();
    }

    EventLog toEventLog(String contractName, AbiEventDefinition event, Log chainLog) {
        Map<String, Object> args;
        String decodeError = null;
        try {
            args = decodeArgs(event, chainLog);
        } catch (RuntimeException | ClassNotFoundException e) {
            log.debug("ABI decode failed for {} tx={} logIndex={}", event.signature(), chainLog.getTransactionHash(), chainLog.getLogIndex(), e);
            args = Map.of();
            decodeError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }
        return new EventLog(
            contractName,
            event.eventName(),
            chainLog.getAddress(),
            chainLog.getTransactionHash(),
            chainLog.getLogIndex().longValueExact(),
            chainLog.getBlockNumber().longValueExact(),
            chainLog.getBlockHash(),
            null,
            args,
            decodeError
        );
    }

    private Map<String, Object> decodeArgs(AbiEventDefinition event, Log chainLog) throws ClassNotFoundException {
        List<String> topics = chainLog.getTopics() == null ? List.of() : chainLog.getTopics();
        int expectedTopics = event.indexedInputs().size() + 1;
        if (topics.size() < expectedTopics) {
            throw new IllegalStateException(
                event.eventName() + " requires at least " + expectedTopics + " topics, got " + topics.size()
            );
        }

        List<AbiEventInput> nonIndexed = event.nonIndexedInputs();
        List<Type> dataValues = List.of();
        if (!nonIndexed.isEmpty()) {
            List<TypeReference<Type>> references = new ArrayList<>();
            for (AbiEventInput input : nonIndexed) {
                references.add(typeReference(input));
            }
            dataValues = FunctionReturnDecoder.decode(chainLog.getData(), references);
            if (dataValues.size() != nonIndexed.size()) {
                throw new IllegalStateException(
                    event.eventName() + " data decode failed: expected " + nonIndexed.size()
                        + " fields, got " + dataValues.size()
                );
            }
        }

        Map<String, Object> args = new LinkedHashMap<>();
        int topicPosition = 1;
        int dataPosition = 0;
        for (AbiEventInput input : event.inputs()) {
            if (input.indexed()) {
                String topic = topics.get(topicPosition++);
                if (input.isDynamic()) {
                    // dynamic indexed values are only available as their keccak hash
                    args.put(input.name(), topic.toLowerCase(Locale.ROOT));
                } else {
                    args.put(input.name(), toJava(FunctionReturnDecoder.decodeIndexedValue(topic, typeReference(input))));
                }
            } else {
                args.put(input.name(), toJava(dataValues.get(dataPosition++)));
            }
        }
        return args;
    }

    private Object toJava(Type value) {
        if (value instanceof Address address) {
            return address.getValue().toLowerCase(Locale.ROOT);
        }
        if (value instanceof NumericType numeric) {
            return numeric.getValue();
        }
        if (value instanceof Bool bool) {
            return bool.getValue();
        }
        if (value instanceof Utf8String text) {
            return text.getValue();
        }
        if (value instanceof BytesType bytes) {
            return Numeric.toHexString(bytes.getValue());
        }
        if (value instanceof Array<?> array) {
            List<Object> items = new ArrayList<>();
            for (Type item : array.getValue()) {
                items.add(toJava(item));
            }
            return List.copyOf(items);
        }
        return String.valueOf(value.getValue());
    }

    @SuppressWarnings("unchecked")
    private TypeReference<Type> typeReference(AbiEventInput input) throws ClassNotFoundException {
        return (TypeReference<Type>) TypeReference.makeTypeReference(input.type());
    }

    private void ensureSuccess(String method, Response<?> response) throws RpcException {
        if (response.hasError()) {
            throw new RpcException(method, response.getError().getCode(), response.getError().getMessage());
        }
    }
}
