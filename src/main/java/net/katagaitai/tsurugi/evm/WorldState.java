package net.katagaitai.tsurugi.evm;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Context;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.tsurugi.evm.cfg.Node;
import net.katagaitai.tsurugi.evm.transaction.BaseTransaction;
import net.katagaitai.tsurugi.util.Constants;
import net.katagaitai.tsurugi.util.Util;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

@Slf4j(topic = "tsurugi")
public class WorldState {
    @Getter
    private final Context context;
    private final Map<BigInteger, Account> accounts;
    @Getter
    private final Constraints constraints;
    private final List<BaseTransaction> transactionSequence;
    // 最初のトランザクションでは前のノードがない
    @Getter
    @Setter
    private Node node;

    public WorldState(Context context) {
        this(context, Maps.newLinkedHashMap(), new Constraints(), Lists.newArrayList(), null);
    }

    private WorldState(Context context, Map<BigInteger, Account> accounts, Constraints constraints,
                       List<BaseTransaction> transactionSequence, Node node) {
        this.context = context;
        this.accounts = accounts;
        this.constraints = constraints;
        this.transactionSequence = transactionSequence;
        this.node = node;
    }

    public Account getAccount(BitVecNum address) {
        return getAccount(address.getBigInteger());
    }

    // 存在しないアドレスは空のアカウントとして作成する
    public Account getAccount(BigInteger address) {
        Account account = accounts.get(address);
        if (account == null) {
            log.debug("アカウントを作成: {}", Util.toAddressHex(address));
            account = new Account(address, Code.EMPTY, null);
            accounts.put(address, account);
        }
        return account;
    }

    public boolean hasAccount(BigInteger address) {
        return accounts.containsKey(address);
    }

    public void putAccount(Account account) {
        accounts.put(account.getAddress(), account);
    }

    public List<Account> getAccounts() {
        return ImmutableList.copyOf(accounts.values());
    }

    public Account findAccount(BigInteger address) {
        return accounts.get(address);
    }

    // creatorの現在のnonceから導出する。nonceは変更しない
    public BigInteger nextContractAddress(BigInteger creator) {
        Account creatorAccount = accounts.get(creator);
        BigInteger nonce = creatorAccount == null ? Constants.INITIAL_NONCE : creatorAccount.getNonce();
        return Util.contractAddress(creator, nonce);
    }

    public void addTransaction(BaseTransaction transaction) {
        transactionSequence.add(transaction);
    }

    public List<BaseTransaction> getTransactionSequence() {
        return ImmutableList.copyOf(transactionSequence);
    }

    // ノードは共有する
    public WorldState copy() {
        Map<BigInteger, Account> accountsCopy = Maps.newLinkedHashMap();
        for (Account account : accounts.values()) {
            accountsCopy.put(account.getAddress(), new Account(account.getAddress(), account.getBalance(),
                    account.getNonce(), account.getStorage().copy(), account.getCode(), account.getContractName()));
        }
        return new WorldState(context, accountsCopy, constraints.copy(),
                Lists.newArrayList(transactionSequence), node);
    }
}
